package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DeployResponse {
    private final String uuid;
    @Builder.Default
    private final String message = "Deployment triggered successfully";
}
