package ai.aedify.autoDeploy.dto;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ProjectCreateResponse {
    private final String uuid;
    private final String name;
    @Builder.Default
    private final String message = "Project created successfully";
}
