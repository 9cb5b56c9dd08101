package ai.aedify.autoDeploy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationCreateRequest {
    private String projectUuid;
    private String environmentName;
    private String gitRepository;
    private String gitBranch = "main";
    private String name;
    // 비어 있으면 설정값(port-counter.container-port) 사용
    private Integer containerPort;
    // 비어 있으면 포트 카운터에서 할당
    private Integer hostPort;
    // 사용자 서브도메인 (예: myapp -> myapp.aedify.ai)
    private String domain;
    private String buildPack = "nixpacks";
}
