package com.devflow.core.git;

import com.devflow.core.config.GitWorkflowProperties;
import com.devflow.core.model.Commit;
import com.devflow.core.model.ProjectState;
import com.devflow.core.model.TestStatus;
import com.devflow.core.model.UncommittedChanges;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ProjectStateReader}.
 */
class ProjectStateReaderTest {

    private static final String PROJECT = "/work/app";

    private GitStatusProvider git;
    private GitWorkflowProperties gitWorkflow;

    @BeforeEach
    void setUp() {
        git = mock(GitStatusProvider.class);
        gitWorkflow = new GitWorkflowProperties();
    }

    @Test
    @DisplayName("reads branch, protection, uncommitted count and last commit time")
    void readsState() {
        Instant committed = Instant.parse("2025-03-01T09:00:00Z");
        when(git.getCurrentBranch(PROJECT)).thenReturn("master");
        when(git.getUncommittedChanges(PROJECT)).thenReturn(Optional.of(new UncommittedChanges(4, "", List.of())));
        when(git.getRecentCommits(PROJECT, 1)).thenReturn(List.of(new Commit("abc", "fix", "dev", committed)));

        ProjectState state = new ProjectStateReader(git, gitWorkflow).read(PROJECT);

        assertEquals("master", state.branch());
        assertTrue(state.isProtected());
        assertEquals(4, state.uncommittedChanges());
        assertEquals(committed, state.lastCommitTime());
        assertEquals(TestStatus.UNKNOWN, state.testStatus());
    }

    @Test
    @DisplayName("a clean feature branch with no commits")
    void cleanBranch() {
        when(git.getCurrentBranch(PROJECT)).thenReturn("feature/login");
        when(git.getUncommittedChanges(PROJECT)).thenReturn(Optional.empty());
        when(git.getRecentCommits(PROJECT, 1)).thenReturn(List.of());

        ProjectState state = new ProjectStateReader(git, gitWorkflow).read(PROJECT);

        assertFalse(state.isProtected());
        assertEquals(0, state.uncommittedChanges());
        assertNull(state.lastCommitTime());
    }

    @Test
    @DisplayName("git failure falls back to defaults")
    void gitFailure() {
        when(git.getCurrentBranch(PROJECT)).thenThrow(new GitStatusException("not a git repository"));

        ProjectState state = new ProjectStateReader(git, gitWorkflow).read(PROJECT);

        assertEquals("main", state.branch());
        assertEquals(0, state.uncommittedChanges());
    }

    @Test
    @DisplayName("without a git provider the main branch is assumed")
    void noProvider() {
        ProjectState state = new ProjectStateReader(null, gitWorkflow).read(PROJECT);

        assertEquals("main", state.branch());
        assertTrue(state.isProtected());
    }
}
