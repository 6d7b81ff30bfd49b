package com.devflow.core.git;

import com.devflow.core.config.GitWorkflowProperties;
import com.devflow.core.model.BuildStatus;
import com.devflow.core.model.Commit;
import com.devflow.core.model.ProjectState;
import com.devflow.core.model.TestStatus;
import com.devflow.core.model.UncommittedChanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Builds a {@link ProjectState} snapshot from the git collaborator.
 * Falls back to defaults (main branch, clean tree, unknown commit time) when git cannot be read.
 */
@Component
public class ProjectStateReader {

    private static final Logger log = LoggerFactory.getLogger(ProjectStateReader.class);

    private final GitStatusProvider gitStatusProvider;
    private final GitWorkflowProperties gitWorkflow;

    public ProjectStateReader(@Autowired(required = false) GitStatusProvider gitStatusProvider,
                              GitWorkflowProperties gitWorkflow) {
        this.gitStatusProvider = gitStatusProvider;
        this.gitWorkflow = gitWorkflow;
    }

    public ProjectState read(String projectPath) {
        String branch = gitWorkflow.getMainBranch();
        int uncommitted = 0;
        Instant lastCommitTime = null;

        if (gitStatusProvider != null) {
            try {
                branch = gitStatusProvider.getCurrentBranch(projectPath);
                uncommitted = gitStatusProvider.getUncommittedChanges(projectPath)
                        .map(UncommittedChanges::fileCount)
                        .orElse(0);
                List<Commit> commits = gitStatusProvider.getRecentCommits(projectPath, 1);
                if (!commits.isEmpty() && commits.get(0).date() != null) {
                    lastCommitTime = commits.get(0).date();
                }
            } catch (Exception e) {
                log.warn("Could not read git state for {}, using defaults: {}", projectPath, e.getMessage());
            }
        }

        return new ProjectState(branch, gitWorkflow.isProtected(branch), uncommitted, lastCommitTime,
                TestStatus.UNKNOWN, BuildStatus.UNKNOWN);
    }
}
