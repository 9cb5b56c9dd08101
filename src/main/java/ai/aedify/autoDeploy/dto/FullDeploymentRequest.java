package ai.aedify.autoDeploy.dto;

import java.util.Map;

public class FullDeploymentRequest {
    private String projectName;
    private String subdomain;
    private String gitRepository;
    private String gitBranch = "main";
    private String baseDirectory;
    private Map<String, String> envVars;

    public FullDeploymentRequest() {
    }

    public FullDeploymentRequest(String projectName, String subdomain, String gitRepository,
                                 String gitBranch, String baseDirectory, Map<String, String> envVars) {
        this.projectName = projectName;
        this.subdomain = subdomain;
        this.gitRepository = gitRepository;
        this.gitBranch = gitBranch;
        this.baseDirectory = baseDirectory;
        this.envVars = envVars;
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public void setSubdomain(String subdomain) {
        this.subdomain = subdomain;
    }

    public String getGitRepository() {
        return gitRepository;
    }

    public void setGitRepository(String gitRepository) {
        this.gitRepository = gitRepository;
    }

    public String getGitBranch() {
        return gitBranch;
    }

    public void setGitBranch(String gitBranch) {
        this.gitBranch = gitBranch;
    }

    public String getBaseDirectory() {
        return baseDirectory;
    }

    public void setBaseDirectory(String baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public Map<String, String> getEnvVars() {
        return envVars;
    }

    public void setEnvVars(Map<String, String> envVars) {
        this.envVars = envVars;
    }
}
