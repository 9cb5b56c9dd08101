package ai.aedify.autoDeploy.util;

import ai.aedify.autoDeploy.config.CoolifyConfig;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 배포 요청 입력값(GitHub URL, 서브도메인, 프로젝트명) 검증 및 정규화.
 * 잘못된 입력은 {@link IllegalArgumentException}으로 알립니다.
 */
@Component
public class DeploymentInputValidator {

    private static final Pattern SUBDOMAIN_PATTERN = Pattern.compile("^[a-z0-9-]+$");
    private static final Pattern PROJECT_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9]+$");

    private final CoolifyConfig coolifyConfig;

    public DeploymentInputValidator(CoolifyConfig coolifyConfig) {
        this.coolifyConfig = coolifyConfig;
    }

    /**
     * GitHub 저장소 URL인지 확인하고 {@code .git}으로 끝나도록 맞춥니다.
     */
    public String validateGithubUrl(String url) {
        if (url == null
                || (!url.startsWith("https://github.com/") && !url.startsWith("http://github.com/"))) {
            throw new IllegalArgumentException("URL must be a GitHub repository");
        }
        return url.endsWith(".git") ? url : url + ".git";
    }

    public String validateSubdomain(String subdomain) {
        if (subdomain == null) {
            throw new IllegalArgumentException("Subdomain cannot be empty");
        }

        String normalized = subdomain.trim().toLowerCase();

        String suffix = "." + coolifyConfig.getDomainSuffix();
        if (normalized.endsWith(suffix)) {
            normalized = normalized.replace(suffix, "");
        }

        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Subdomain cannot be empty");
        }
        if (!SUBDOMAIN_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                    "Subdomain can only contain letters, numbers, and hyphens (no spaces or special characters)");
        }
        if (normalized.startsWith("-") || normalized.endsWith("-")) {
            throw new IllegalArgumentException("Subdomain cannot start or end with a hyphen");
        }
        return normalized;
    }

    public String validateProjectName(String projectName) {
        String normalized = projectName == null ? "" : projectName.trim();

        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Project name cannot be empty");
        }
        if (!PROJECT_NAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                    "Project name can only contain letters and numbers (no spaces or special characters)");
        }
        return normalized;
    }

    /**
     * {@code https://github.com/user/repo.git} -> {@code repo}
     */
    public String extractAppName(String gitRepository) {
        String[] parts = gitRepository.split("/");
        return parts[parts.length - 1].replace(".git", "");
    }
}
