package ai.aedify.autoDeploy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DeploymentStatusResponse {
    private final String status;
    private final String message;
}
