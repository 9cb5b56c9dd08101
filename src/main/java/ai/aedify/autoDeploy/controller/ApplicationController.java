package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.dto.ApplicationCreateRequest;
import ai.aedify.autoDeploy.dto.EnvVarRequest;
import ai.aedify.autoDeploy.service.DeploymentService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/applications")
@RequiredArgsConstructor
public class ApplicationController {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationController.class);

    private final DeploymentService deploymentService;

    @PostMapping
    public ResponseEntity<Object> createApplication(@RequestBody ApplicationCreateRequest request) {
        try {
            logger.info("Creating application: name={}, project={}", request.getName(), request.getProjectUuid());
            return ResponseEntity.ok(deploymentService.createApplication(request));
        } catch (Exception e) {
            logger.error("Error creating application: name={}, error={}", request.getName(), e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }

    @PostMapping("/{appUuid}/envs")
    public ResponseEntity<Object> setEnvironmentVariable(@PathVariable("appUuid") String appUuid,
                                                         @RequestBody EnvVarRequest request) {
        try {
            if (request.getKey() == null || request.getKey().isBlank()) {
                throw new IllegalArgumentException("Environment variable key cannot be empty");
            }
            return ResponseEntity.ok(deploymentService.setEnvironmentVariable(appUuid, request));
        } catch (Exception e) {
            logger.error("Error setting env var: appUuid={}, key={}, error={}", appUuid, request.getKey(), e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }

    @PostMapping("/{appUuid}/deploy")
    public ResponseEntity<Object> triggerDeployment(@PathVariable("appUuid") String appUuid) {
        try {
            return ResponseEntity.ok(deploymentService.triggerDeployment(appUuid));
        } catch (Exception e) {
            logger.error("Error triggering deployment: appUuid={}, error={}", appUuid, e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }

    @GetMapping("/{appUuid}/status")
    public ResponseEntity<Object> getDeploymentStatus(@PathVariable("appUuid") String appUuid) {
        try {
            return ResponseEntity.ok(deploymentService.getDeploymentStatus(appUuid));
        } catch (Exception e) {
            logger.error("Error fetching deployment status: appUuid={}, error={}", appUuid, e.getMessage());
            return ErrorResponses.from(e, "");
        }
    }
}
