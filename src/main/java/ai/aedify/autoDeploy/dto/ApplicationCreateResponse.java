package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ApplicationCreateResponse {
    private final String uuid;
    private final String name;
    private final int hostPort;
    @Builder.Default
    private final String message = "Application created successfully";
}
