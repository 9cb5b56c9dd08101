package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EnvVarResponse {
    private final String uuid;
    private final String message;
}
