package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class FullDeploymentResponse {
    private final String projectUuid;
    private final String environmentUuid;
    private final String appUuid;
    private final String appName;
    private final int hostPort;
    private final String deploymentStatus;
    private final String coolifyUrl;
    private final String fqdn;
    private final String url;
    @Builder.Default
    private final String message = "Full deployment completed";
}
