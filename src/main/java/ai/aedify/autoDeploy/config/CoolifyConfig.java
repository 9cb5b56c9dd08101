package ai.aedify.autoDeploy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "coolify")
public class CoolifyConfig {

    private String url;
    private String apiToken;
    private String deployServerUuid;
    private String dockerhubImage;
    private String domainSuffix = "aedify.ai";
    private String buildPack = "nixpacks";

    // 애플리케이션 생성 직후 환경변수 설정 전 대기 시간
    private Duration provisionWait = Duration.ofSeconds(3);
    private Duration statusCheckDelay = Duration.ofSeconds(2);

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getDeployServerUuid() {
        return deployServerUuid;
    }

    public void setDeployServerUuid(String deployServerUuid) {
        this.deployServerUuid = deployServerUuid;
    }

    public String getDockerhubImage() {
        return dockerhubImage;
    }

    public void setDockerhubImage(String dockerhubImage) {
        this.dockerhubImage = dockerhubImage;
    }

    public String getDomainSuffix() {
        return domainSuffix;
    }

    public void setDomainSuffix(String domainSuffix) {
        this.domainSuffix = domainSuffix;
    }

    public String getBuildPack() {
        return buildPack;
    }

    public void setBuildPack(String buildPack) {
        this.buildPack = buildPack;
    }

    public Duration getProvisionWait() {
        return provisionWait;
    }

    public void setProvisionWait(Duration provisionWait) {
        this.provisionWait = provisionWait;
    }

    public Duration getStatusCheckDelay() {
        return statusCheckDelay;
    }

    public void setStatusCheckDelay(Duration statusCheckDelay) {
        this.statusCheckDelay = statusCheckDelay;
    }
}
