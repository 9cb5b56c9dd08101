package ai.aedify.autoDeploy.infra;

import ai.aedify.autoDeploy.config.CoolifyConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coolify REST API(v1) 호출을 담당합니다.
 * <p>
 * 4xx/5xx 응답은 Coolify의 상태 코드와 본문을 담은 {@link CoolifyApiException}으로,
 * 연결 실패 등은 500 {@link CoolifyApiException}으로 변환합니다.
 */
@Component
public class CoolifyClient {

    private static final Logger logger = LoggerFactory.getLogger(CoolifyClient.class);

    private final CoolifyConfig coolifyConfig;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public CoolifyClient(CoolifyConfig coolifyConfig,
                         ObjectMapper objectMapper,
                         RestClient.Builder restClientBuilder) {
        this.coolifyConfig = coolifyConfig;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + coolifyConfig.getApiToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    public JsonNode createProject(String name, String description) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("description", description);
        return post("/api/v1/projects", payload);
    }

    public JsonNode getProject(String projectUuid) {
        return get("/api/v1/projects/" + projectUuid);
    }

    public JsonNode createPublicApplication(Map<String, Object> payload) {
        return post("/api/v1/applications/public", payload);
    }

    public JsonNode setEnvironmentVariable(String appUuid, String key, String value,
                                           boolean isPreview, boolean isLiteral) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", key);
        payload.put("value", value);
        payload.put("is_preview", isPreview);
        payload.put("is_literal", isLiteral);
        return post("/api/v1/applications/" + appUuid + "/envs", payload);
    }

    public JsonNode triggerDeployment(String appUuid) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("uuid", appUuid);
        return post("/api/v1/deploy", payload);
    }

    /**
     * 애플리케이션의 배포 이력. 가장 최근 배포가 첫 번째 원소입니다.
     */
    public JsonNode getDeployments(String appUuid) {
        return get("/api/v1/applications/" + appUuid + "/deployments");
    }

    public String applicationUrl(String appUuid) {
        return coolifyConfig.getUrl() + "/applications/" + appUuid;
    }

    JsonNode post(String endpoint, Object payload) {
        logger.debug("Coolify POST {}", endpoint);
        try {
            return restClient.post()
                    .uri(coolifyConfig.getUrl() + endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toApiException("POST", endpoint, response);
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw connectionFailure("POST", endpoint, e);
        }
    }

    JsonNode get(String endpoint) {
        logger.debug("Coolify GET {}", endpoint);
        try {
            return restClient.get()
                    .uri(coolifyConfig.getUrl() + endpoint)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw toApiException("GET", endpoint, response);
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw connectionFailure("GET", endpoint, e);
        }
    }

    private CoolifyApiException toApiException(String method, String endpoint, ClientHttpResponse response)
            throws IOException {
        int statusCode = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);

        Object detail = body;
        if (!body.isBlank()) {
            try {
                detail = objectMapper.readTree(body);
            } catch (IOException e) {
                logger.debug("Coolify 오류 응답이 JSON이 아닙니다: {}", e.getMessage());
            }
        }

        logger.error("Coolify {} {} 실패 - status: {}, body: {}", method, endpoint, statusCode, body);
        return new CoolifyApiException(statusCode, detail,
                String.format("Coolify %s %s failed with status %d", method, endpoint, statusCode));
    }

    private CoolifyApiException connectionFailure(String method, String endpoint, RestClientException e) {
        String errorMessage = String.format("Coolify %s %s 호출 중 오류 발생: %s", method, endpoint, e.getMessage());
        logger.error(errorMessage, e);
        return new CoolifyApiException(500, e.getMessage(), errorMessage, e);
    }
}
