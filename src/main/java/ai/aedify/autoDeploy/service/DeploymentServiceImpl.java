package ai.aedify.autoDeploy.service;

import ai.aedify.autoDeploy.config.CoolifyConfig;
import ai.aedify.autoDeploy.config.PortCounterConfig;
import ai.aedify.autoDeploy.dto.*;
import ai.aedify.autoDeploy.infra.CoolifyApiException;
import ai.aedify.autoDeploy.infra.CoolifyClient;
import ai.aedify.autoDeploy.portCounter.PortCounter;
import ai.aedify.autoDeploy.util.DeploymentInputValidator;
import ai.aedify.autoDeploy.util.SystemEnvVarGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class DeploymentServiceImpl implements DeploymentService {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentServiceImpl.class);

    private static final Map<String, String> STATUS_MESSAGES = Map.of(
            "finished", "Deployment completed successfully",
            "failed", "Deployment failed",
            "in_progress", "Deployment in progress",
            "queued", "Deployment queued"
    );

    private final CoolifyClient coolifyClient;
    private final PortCounter portCounter;
    private final DeploymentInputValidator inputValidator;
    private final SystemEnvVarGenerator systemEnvVarGenerator;
    private final CoolifyConfig coolifyConfig;
    private final PortCounterConfig portCounterConfig;

    public DeploymentServiceImpl(CoolifyClient coolifyClient,
                                 PortCounter portCounter,
                                 DeploymentInputValidator inputValidator,
                                 SystemEnvVarGenerator systemEnvVarGenerator,
                                 CoolifyConfig coolifyConfig,
                                 PortCounterConfig portCounterConfig) {
        this.coolifyClient = coolifyClient;
        this.portCounter = portCounter;
        this.inputValidator = inputValidator;
        this.systemEnvVarGenerator = systemEnvVarGenerator;
        this.coolifyConfig = coolifyConfig;
        this.portCounterConfig = portCounterConfig;
    }

    @Override
    public ProjectCreateResponse createProject(ProjectCreateRequest request) {
        String description = request.getDescription() != null
                ? request.getDescription()
                : "Auto-created project: " + request.getName();

        JsonNode result = coolifyClient.createProject(request.getName(), description);
        logger.info("프로젝트 생성 완료: {} ({})", request.getName(), result.path("uuid").asText());

        return ProjectCreateResponse.builder()
                .uuid(result.path("uuid").asText())
                .name(result.path("name").asText(request.getName()))
                .build();
    }

    @Override
    public EnvironmentResponse getEnvironment(String projectUuid) {
        JsonNode environment = firstEnvironment(projectUuid);
        return EnvironmentResponse.builder()
                .environmentUuid(environment.path("uuid").asText())
                .environmentName(environment.path("name").asText())
                .projectUuid(projectUuid)
                .build();
    }

    @Override
    public ApplicationCreateResponse createApplication(ApplicationCreateRequest request) {
        String gitRepository = inputValidator.validateGithubUrl(request.getGitRepository());
        int containerPort = request.getContainerPort() != null
                ? request.getContainerPort()
                : portCounterConfig.getContainerPort();
        int hostPort = request.getHostPort() != null
                ? request.getHostPort()
                : portCounter.allocateNext();

        Map<String, Object> payload = applicationPayload(
                request.getProjectUuid(),
                request.getEnvironmentName(),
                gitRepository,
                request.getGitBranch(),
                request.getBuildPack(),
                request.getName(),
                hostPort,
                containerPort);

        JsonNode app = createApplicationOrReportUnusedPort(payload, hostPort, request.getHostPort() == null);
        String appUuid = app.path("uuid").asText();
        pause(coolifyConfig.getProvisionWait());

        if (request.getDomain() != null && !request.getDomain().isBlank()) {
            injectEnvVars(appUuid, systemEnvVarGenerator.generate(request.getDomain()), "시스템");
        }

        return ApplicationCreateResponse.builder()
                .uuid(appUuid)
                .name(app.path("name").asText(request.getName()))
                .hostPort(hostPort)
                .build();
    }

    @Override
    public EnvVarResponse setEnvironmentVariable(String appUuid, EnvVarRequest request) {
        JsonNode result = coolifyClient.setEnvironmentVariable(
                appUuid, request.getKey(), request.getValue(), request.isPreview(), request.isLiteral());

        return EnvVarResponse.builder()
                .uuid(result != null && result.hasNonNull("uuid") ? result.get("uuid").asText() : null)
                .message(String.format("Environment variable '%s' set successfully", request.getKey()))
                .build();
    }

    @Override
    public DeployResponse triggerDeployment(String appUuid) {
        coolifyClient.triggerDeployment(appUuid);
        logger.info("배포 트리거 완료: {}", appUuid);
        return DeployResponse.builder()
                .uuid(appUuid)
                .build();
    }

    @Override
    public DeploymentStatusResponse getDeploymentStatus(String appUuid) {
        try {
            JsonNode deployments = coolifyClient.getDeployments(appUuid);
            if (deployments == null || !deployments.isArray() || deployments.isEmpty()) {
                return new DeploymentStatusResponse("no_deployments", "No deployments found for this application");
            }

            String status = deployments.get(0).path("status").asText("unknown");
            return new DeploymentStatusResponse(
                    status,
                    STATUS_MESSAGES.getOrDefault(status, "Deployment status: " + status));
        } catch (Exception e) {
            throw new RuntimeException("Failed to get deployment status: " + e.getMessage(), e);
        }
    }

    @Override
    public FullDeploymentResponse deployFull(FullDeploymentRequest request) {
        String projectName = inputValidator.validateProjectName(request.getProjectName());
        String subdomain = inputValidator.validateSubdomain(request.getSubdomain());
        String gitRepository = inputValidator.validateGithubUrl(request.getGitRepository());
        String appName = inputValidator.extractAppName(gitRepository);

        logger.info("전체 배포 시작 - 프로젝트: {}, 앱: {}, 서브도메인: {}", projectName, appName, subdomain);

        // 1. 프로젝트 생성
        JsonNode project = coolifyClient.createProject(projectName, "Auto-created for " + appName);
        String projectUuid = project.path("uuid").asText();
        logger.info("[1] 프로젝트 생성 완료: {} ({})", projectName, projectUuid);

        // 2. 환경 조회
        JsonNode environment = firstEnvironment(projectUuid);
        String environmentUuid = environment.path("uuid").asText();
        String environmentName = environment.path("name").asText();
        logger.info("[2] 환경 조회 완료: {} ({})", environmentName, environmentUuid);

        // 3. 호스트 포트 할당 후 애플리케이션 생성
        // 포트는 되돌릴 수 없으므로 애플리케이션 생성 직전에 할당
        int hostPort = portCounter.allocateNext();
        int containerPort = portCounterConfig.getContainerPort();

        Map<String, Object> payload = applicationPayload(
                projectUuid,
                environmentName,
                gitRepository,
                request.getGitBranch() != null ? request.getGitBranch() : "main",
                coolifyConfig.getBuildPack(),
                appName,
                hostPort,
                containerPort);
        if (request.getBaseDirectory() != null && !request.getBaseDirectory().isBlank()) {
            payload.put("base_directory", request.getBaseDirectory());
        }

        String appUuid = createApplicationOrReportUnusedPort(payload, hostPort, true).path("uuid").asText();
        logger.info("[3] 애플리케이션 생성 완료: {} ({}), 포트 매핑 {}:{}", appName, appUuid, hostPort, containerPort);

        pause(coolifyConfig.getProvisionWait());

        // 4. 환경변수 설정 (시스템 -> 사용자 순서)
        Map<String, String> systemEnvVars = systemEnvVarGenerator.generate(subdomain);
        injectEnvVars(appUuid, systemEnvVars, "시스템");
        if (request.getEnvVars() != null && !request.getEnvVars().isEmpty()) {
            injectEnvVars(appUuid, request.getEnvVars(), "사용자");
        }

        // 5. 배포 트리거
        coolifyClient.triggerDeployment(appUuid);
        logger.info("[5] 배포 트리거 완료: {}", appUuid);

        // 6. 초기 배포 상태 확인
        pause(coolifyConfig.getStatusCheckDelay());
        String status = initialDeploymentStatus(appUuid);

        logger.info("전체 배포 요청 완료 - 앱: {}, 상태: {}", appName, status);

        return FullDeploymentResponse.builder()
                .projectUuid(projectUuid)
                .environmentUuid(environmentUuid)
                .appUuid(appUuid)
                .appName(appName)
                .hostPort(hostPort)
                .deploymentStatus(status)
                .coolifyUrl(coolifyClient.applicationUrl(appUuid))
                .fqdn(systemEnvVars.get(SystemEnvVarGenerator.FQDN_KEY))
                .url(systemEnvVars.get(SystemEnvVarGenerator.URL_KEY))
                .message("Full deployment initiated successfully")
                .build();
    }

    private JsonNode firstEnvironment(String projectUuid) {
        JsonNode projectInfo = coolifyClient.getProject(projectUuid);
        JsonNode environments = projectInfo != null ? projectInfo.path("environments") : null;
        if (environments == null || !environments.isArray() || environments.isEmpty()) {
            throw new CoolifyApiException(404, "No environments found for project",
                    "No environments found for project " + projectUuid);
        }
        return environments.get(0);
    }

    private Map<String, Object> applicationPayload(String projectUuid, String environmentName,
                                                   String gitRepository, String gitBranch, String buildPack,
                                                   String name, int hostPort, int containerPort) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("project_uuid", projectUuid);
        payload.put("server_uuid", coolifyConfig.getDeployServerUuid());
        payload.put("environment_name", environmentName);
        payload.put("destination_uuid", coolifyConfig.getDeployServerUuid());
        payload.put("git_repository", gitRepository);
        payload.put("git_branch", gitBranch);
        payload.put("build_pack", buildPack);
        payload.put("name", name);
        payload.put("ports_exposes", String.valueOf(containerPort));
        payload.put("ports_mappings", hostPort + ":" + containerPort);
        payload.put("docker_registry_image_name", coolifyConfig.getDockerhubImage());
        payload.put("instant_deploy", false);
        return payload;
    }

    private JsonNode createApplicationOrReportUnusedPort(Map<String, Object> payload, int hostPort,
                                                         boolean allocated) {
        try {
            return coolifyClient.createPublicApplication(payload);
        } catch (RuntimeException e) {
            if (allocated) {
                logger.warn("애플리케이션 생성 실패로 할당된 호스트 포트 {}는 사용되지 않습니다: {}",
                        hostPort, e.getMessage());
            }
            throw e;
        }
    }

    private void injectEnvVars(String appUuid, Map<String, String> envVars, String kind) {
        for (Map.Entry<String, String> envVar : envVars.entrySet()) {
            try {
                coolifyClient.setEnvironmentVariable(appUuid, envVar.getKey(), envVar.getValue(), false, true);
                logger.info("{} 환경변수 설정 완료: {}", kind, envVar.getKey());
            } catch (Exception e) {
                // 환경변수 하나가 실패해도 배포는 계속 진행
                logger.warn("{} 환경변수 설정 실패: {} ({})", kind, envVar.getKey(), e.getMessage());
            }
        }
    }

    private String initialDeploymentStatus(String appUuid) {
        try {
            JsonNode deployments = coolifyClient.getDeployments(appUuid);
            if (deployments == null || !deployments.isArray() || deployments.isEmpty()) {
                return "queued";
            }
            return deployments.get(0).path("status").asText("unknown");
        } catch (Exception e) {
            logger.warn("초기 배포 상태 조회 실패: {}", e.getMessage());
            return "unknown";
        }
    }

    private void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("배포 대기 중 인터럽트 발생", e);
        }
    }
}
