package ai.aedify.autoDeploy.util;

import ai.aedify.autoDeploy.config.CoolifyConfig;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사용자 서브도메인으로부터 애플리케이션에 주입할 시스템 환경변수(COOLIFY_FQDN, URL)를 만듭니다.
 */
@Component
public class SystemEnvVarGenerator {

    public static final String FQDN_KEY = "COOLIFY_FQDN";
    public static final String URL_KEY = "URL";

    private final CoolifyConfig coolifyConfig;

    public SystemEnvVarGenerator(CoolifyConfig coolifyConfig) {
        this.coolifyConfig = coolifyConfig;
    }

    public Map<String, String> generate(String domain) {
        String suffix = "." + coolifyConfig.getDomainSuffix();
        String fqdn = domain.endsWith(suffix) ? domain : domain + suffix;

        Map<String, String> envVars = new LinkedHashMap<>();
        envVars.put(FQDN_KEY, fqdn);
        envVars.put(URL_KEY, "https://" + fqdn);
        return envVars;
    }
}
