package com.devflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "devflow.git-workflow")
public class GitWorkflowProperties {

    private String mainBranch = "main";
    private List<String> protectedBranches = List.of("main", "master");

    public String getMainBranch() {
        return mainBranch;
    }

    public void setMainBranch(String mainBranch) {
        this.mainBranch = mainBranch;
    }

    public List<String> getProtectedBranches() {
        return protectedBranches;
    }

    public void setProtectedBranches(List<String> protectedBranches) {
        this.protectedBranches = protectedBranches;
    }

    public boolean isProtected(String branch) {
        return branch != null && protectedBranches.contains(branch);
    }
}
