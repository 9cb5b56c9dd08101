package ai.aedify.autoDeploy.service;

import ai.aedify.autoDeploy.dto.*;

public interface DeploymentService {

    ProjectCreateResponse createProject(ProjectCreateRequest request);

    /**
     * 프로젝트의 첫 번째 환경을 조회합니다.
     */
    EnvironmentResponse getEnvironment(String projectUuid);

    /**
     * 애플리케이션을 생성합니다. 호스트 포트가 지정되지 않으면 포트 카운터에서 할당받습니다.
     */
    ApplicationCreateResponse createApplication(ApplicationCreateRequest request);

    EnvVarResponse setEnvironmentVariable(String appUuid, EnvVarRequest request);

    DeployResponse triggerDeployment(String appUuid);

    DeploymentStatusResponse getDeploymentStatus(String appUuid);

    /**
     * 프로젝트 생성부터 배포 트리거까지 전체 흐름을 실행합니다.
     * 애플리케이션마다 포트 카운터에서 호스트 포트를 하나씩 할당받습니다.
     *
     * @param request 프로젝트명, 서브도메인, GitHub 저장소, 브랜치, 환경변수
     * @return 생성된 리소스 UUID와 접속 URL
     */
    FullDeploymentResponse deployFull(FullDeploymentRequest request);
}
