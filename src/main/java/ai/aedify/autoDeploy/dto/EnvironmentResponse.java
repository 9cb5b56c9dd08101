package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EnvironmentResponse {
    private final String environmentUuid;
    private final String environmentName;
    private final String projectUuid;
}
