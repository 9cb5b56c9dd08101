package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.dto.ErrorResponse;
import ai.aedify.autoDeploy.dto.FullDeploymentRequest;
import ai.aedify.autoDeploy.dto.FullDeploymentResponse;
import ai.aedify.autoDeploy.service.DeploymentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DeploymentController {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentController.class);

    private final DeploymentService deploymentService;

    public DeploymentController(DeploymentService deploymentService) {
        this.deploymentService = deploymentService;
    }

    /**
     * 프로젝트 생성, 포트 할당, 애플리케이션 생성, 환경변수 설정, 배포 트리거를 한 번에 수행합니다.
     *
     * @param request 프로젝트명, 서브도메인, GitHub 저장소 URL, 브랜치, 기본 디렉터리, 환경변수
     * @return 생성된 리소스 정보와 접속 URL
     */
    @PostMapping("/deploy")
    public ResponseEntity<Object> deploy(@RequestBody FullDeploymentRequest request) {
        logger.info("전체 배포 요청 수신 - 프로젝트: {}, 저장소: {}",
                request.getProjectName(), request.getGitRepository());

        try {
            FullDeploymentResponse response = deploymentService.deployFull(request);
            logger.info("전체 배포 성공 - 앱: {}, 포트: {}", response.getAppName(), response.getHostPort());
            return ResponseEntity.ok(response);

        } catch (IllegalArgumentException e) {
            logger.error("배포 요청 검증 실패: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));

        } catch (Exception e) {
            logger.error("배포 중 오류 발생", e);
            return ErrorResponses.from(e, "Deployment failed: ");
        }
    }
}
