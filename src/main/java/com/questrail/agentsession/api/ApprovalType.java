package com.questrail.agentsession.api;

/**
 * Kind of approval the agent runtime is waiting for.
 */
public enum ApprovalType {
    /** Shell command execution. */
    EXEC,

    /** File patch application. */
    PATCH,

    /** Free-form question to the user. */
    QUESTION;

    /**
     * Tool name recorded alongside a persisted approval request.
     */
    public String toolName() {
        return switch (this) {
            case EXEC -> "Bash";
            case PATCH -> "Edit";
            case QUESTION -> "Question";
        };
    }
}
