package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.dto.ProjectCreateRequest;
import ai.aedify.autoDeploy.service.DeploymentService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private static final Logger logger = LoggerFactory.getLogger(ProjectController.class);

    private final DeploymentService deploymentService;

    @PostMapping
    public ResponseEntity<Object> createProject(@RequestBody ProjectCreateRequest request) {
        try {
            if (request.getName() == null || request.getName().isBlank()) {
                throw new IllegalArgumentException("Project name cannot be empty");
            }
            logger.info("Creating project: name={}", request.getName());
            return ResponseEntity.ok(deploymentService.createProject(request));
        } catch (Exception e) {
            logger.error("Error creating project: name={}, error={}", request.getName(), e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }

    @GetMapping("/{projectUuid}/environment")
    public ResponseEntity<Object> getEnvironment(@PathVariable("projectUuid") String projectUuid) {
        try {
            return ResponseEntity.ok(deploymentService.getEnvironment(projectUuid));
        } catch (Exception e) {
            logger.error("Error fetching environment: projectUuid={}, error={}", projectUuid, e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }
}
