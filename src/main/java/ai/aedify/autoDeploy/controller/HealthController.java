package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.config.CoolifyConfig;
import ai.aedify.autoDeploy.portCounter.PortCounterInitializer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final CoolifyConfig coolifyConfig;
    private final PortCounterInitializer portCounterInitializer;

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("create_project", "POST /api/projects");
        endpoints.put("get_environment", "GET /api/projects/{uuid}/environment");
        endpoints.put("create_application", "POST /api/applications");
        endpoints.put("set_env_var", "POST /api/applications/{uuid}/envs");
        endpoints.put("deploy", "POST /api/applications/{uuid}/deploy");
        endpoints.put("deployment_status", "GET /api/applications/{uuid}/status");
        endpoints.put("full_deployment", "POST /api/deploy");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Coolify Deployment API");
        body.put("version", "1.0.0");
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("coolify_url", isSet(coolifyConfig.getUrl()));
        config.put("api_token", isSet(coolifyConfig.getApiToken()));
        config.put("deploy_server_uuid", isSet(coolifyConfig.getDeployServerUuid()));
        config.put("dockerhub_image", isSet(coolifyConfig.getDockerhubImage()));
        config.put("port_counter", portCounterInitializer.isInitialized());

        boolean allConfigured = config.values().stream().allMatch(Boolean.TRUE::equals);

        Map<String, Object> portCounter = new LinkedHashMap<>();
        portCounter.put("backend", portCounterInitializer.getBackendName());
        portCounter.put("initialized", portCounterInitializer.isInitialized());
        if (portCounterInitializer.getLastError() != null) {
            portCounter.put("error", portCounterInitializer.getLastError());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", allConfigured ? "healthy" : "misconfigured");
        body.put("config", config);
        body.put("port_counter", portCounter);
        return body;
    }

    private boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
