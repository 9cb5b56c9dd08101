package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.dto.EnvVarRequest;
import ai.aedify.autoDeploy.dto.EnvVarResponse;
import ai.aedify.autoDeploy.dto.FullDeploymentRequest;
import ai.aedify.autoDeploy.dto.FullDeploymentResponse;
import ai.aedify.autoDeploy.infra.CoolifyApiException;
import ai.aedify.autoDeploy.portCounter.LockTimeoutException;
import ai.aedify.autoDeploy.portCounter.NotInitializedException;
import ai.aedify.autoDeploy.service.DeploymentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DeploymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DeploymentService deploymentService;

    @Test
    void deploy_성공() throws Exception {
        // given
        FullDeploymentRequest request = new FullDeploymentRequest(
                "MyProject", "myapp", "https://github.com/aedify/todo-app.git", "main", null, Map.of("KEY", "value"));

        when(deploymentService.deployFull(any(FullDeploymentRequest.class))).thenReturn(
                FullDeploymentResponse.builder()
                        .projectUuid("proj-1")
                        .environmentUuid("env-1")
                        .appUuid("app-1")
                        .appName("todo-app")
                        .hostPort(3003)
                        .deploymentStatus("queued")
                        .coolifyUrl("http://coolify.test/applications/app-1")
                        .fqdn("myapp.aedify.ai")
                        .url("https://myapp.aedify.ai")
                        .message("Full deployment initiated successfully")
                        .build());

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.app_uuid").value("app-1"))
                .andExpect(jsonPath("$.host_port").value(3003))
                .andExpect(jsonPath("$.fqdn").value("myapp.aedify.ai"))
                .andExpect(jsonPath("$.message").value("Full deployment initiated successfully"));

        ArgumentCaptor<FullDeploymentRequest> captor = ArgumentCaptor.forClass(FullDeploymentRequest.class);
        verify(deploymentService).deployFull(captor.capture());
        assertThat(captor.getValue().getProjectName()).isEqualTo("MyProject");
        assertThat(captor.getValue().getEnvVars()).containsEntry("KEY", "value");
    }

    @Test
    void deploy_snake_case_본문과_기본_브랜치() throws Exception {
        // given
        String body = """
                {
                  "project_name": "MyProject",
                  "subdomain": "myapp",
                  "git_repository": "https://github.com/aedify/todo-app",
                  "base_directory": "/web"
                }
                """;
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenReturn(FullDeploymentResponse.builder().appUuid("app-1").build());

        // when
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        // then
        ArgumentCaptor<FullDeploymentRequest> captor = ArgumentCaptor.forClass(FullDeploymentRequest.class);
        verify(deploymentService).deployFull(captor.capture());
        assertThat(captor.getValue().getGitBranch()).isEqualTo("main");
        assertThat(captor.getValue().getBaseDirectory()).isEqualTo("/web");
    }

    @Test
    void deploy_입력_검증_실패() throws Exception {
        // given
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenThrow(new IllegalArgumentException("Subdomain cannot be empty"));

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_name\":\"MyProject\",\"subdomain\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Subdomain cannot be empty"));
    }

    @Test
    void deploy_포트_할당_실패는_503() throws Exception {
        // given
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenThrow(new NotInitializedException("포트 카운터 행이 없습니다."));

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void deploy_잠금_시간_초과도_503() throws Exception {
        // given
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenThrow(new LockTimeoutException("lock wait timeout"));

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value("Host port allocation failed: lock wait timeout"));
    }

    @Test
    void deploy_Coolify_오류는_상태코드_그대로_전달() throws Exception {
        // given
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenThrow(new CoolifyApiException(422, "invalid git repository", "Coolify POST failed"));

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail.status_code").value(422))
                .andExpect(jsonPath("$.detail.detail").value("invalid git repository"));
    }

    @Test
    void deploy_예상치_못한_오류는_500() throws Exception {
        // given
        when(deploymentService.deployFull(any(FullDeploymentRequest.class)))
                .thenThrow(new RuntimeException("boom"));

        // when & then
        mockMvc.perform(post("/api/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Deployment failed: boom"));
    }

    @Test
    void 환경변수_설정_요청의_플래그_매핑() throws Exception {
        // given
        when(deploymentService.setEnvironmentVariable(eq("app-1"), any(EnvVarRequest.class)))
                .thenReturn(EnvVarResponse.builder().uuid("env-var-1").message("ok").build());

        // when
        mockMvc.perform(post("/api/applications/app-1/envs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"API_KEY\",\"value\":\"abc\",\"is_preview\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uuid").value("env-var-1"));

        // then
        ArgumentCaptor<EnvVarRequest> captor = ArgumentCaptor.forClass(EnvVarRequest.class);
        verify(deploymentService).setEnvironmentVariable(eq("app-1"), captor.capture());
        assertThat(captor.getValue().isPreview()).isTrue();
        assertThat(captor.getValue().isLiteral()).isTrue();
    }

    @Test
    void 프로젝트명이_없으면_400() throws Exception {
        mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"no name\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Project name cannot be empty"));
    }

    @Test
    void health_설정과_포트_카운터_상태() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.config.coolify_url").value(true))
                .andExpect(jsonPath("$.port_counter.backend").value("file"))
                .andExpect(jsonPath("$.port_counter.initialized").value(true));
    }

    @Test
    void root_엔드포인트_목록() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints.full_deployment").value("POST /api/deploy"));
    }
}
