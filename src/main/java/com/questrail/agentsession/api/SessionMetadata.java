package com.questrail.agentsession.api;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionMetadata
 * -----------------------------------------------------------------------------
 * Descriptive, slowly changing facts about a session.
 *
 * <p>Metadata changes are always published as a complete replacement value,
 * so a viewer (or a replay) never has to merge partial metadata.</p>
 *
 * @param forkedFromSessionId session this one was forked from, if any
 * @param startedAt           creation time of the session
 */
public record SessionMetadata(Provider provider,
                              String projectPath,
                              String projectName,
                              String model,
                              String customName,
                              String approvalPolicy,
                              String sandboxMode,
                              String forkedFromSessionId,
                              Instant startedAt,
                              String currentCwd,
                              String gitBranch,
                              String gitSha)
{
    public SessionMetadata {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(projectPath, "projectPath");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    /**
     * Minimal metadata for a freshly created session.
     */
    public static SessionMetadata of(Provider provider, String projectPath, Instant startedAt) {
        return new SessionMetadata(provider, projectPath, null, null, null,
                null, null, null, startedAt, null, null, null);
    }

    public SessionMetadata withModel(String newModel) {
        return new SessionMetadata(provider, projectPath, projectName, newModel, customName,
                approvalPolicy, sandboxMode, forkedFromSessionId, startedAt,
                currentCwd, gitBranch, gitSha);
    }

    public SessionMetadata withCustomName(String newName) {
        return new SessionMetadata(provider, projectPath, projectName, model, newName,
                approvalPolicy, sandboxMode, forkedFromSessionId, startedAt,
                currentCwd, gitBranch, gitSha);
    }

    public SessionMetadata withConfig(String newApprovalPolicy, String newSandboxMode) {
        return new SessionMetadata(provider, projectPath, projectName, model, customName,
                newApprovalPolicy, newSandboxMode, forkedFromSessionId, startedAt,
                currentCwd, gitBranch, gitSha);
    }

    public SessionMetadata withEnvironment(String cwd, String branch, String sha) {
        return new SessionMetadata(provider, projectPath, projectName, model, customName,
                approvalPolicy, sandboxMode, forkedFromSessionId, startedAt,
                cwd, branch, sha);
    }

    public SessionMetadata withProjectName(String newProjectName) {
        return new SessionMetadata(provider, projectPath, newProjectName, model, customName,
                approvalPolicy, sandboxMode, forkedFromSessionId, startedAt,
                currentCwd, gitBranch, gitSha);
    }

    public SessionMetadata withForkedFrom(String sourceSessionId) {
        return new SessionMetadata(provider, projectPath, projectName, model, customName,
                approvalPolicy, sandboxMode, sourceSessionId, startedAt,
                currentCwd, gitBranch, gitSha);
    }
}
