package com.questrail.agentsession.api;

import java.util.Locale;
import java.util.Objects;

/**
 * User decision for a pending approval request.
 */
public enum ApprovalDecision {
    APPROVED,
    APPROVED_FOR_SESSION,
    DENIED,
    ABORT;

    /**
     * Returns {@code true} if the agent may proceed with the requested action.
     */
    public boolean isApproved() {
        return this == APPROVED || this == APPROVED_FOR_SESSION;
    }

    /**
     * Wire and storage representation, e.g. {@code approved_for_session}.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value as sent by viewers.
     *
     * @throws IllegalArgumentException if the value is not a known decision
     */
    public static ApprovalDecision fromWireValue(String value) {
        Objects.requireNonNull(value, "value");
        for (ApprovalDecision decision : values()) {
            if (decision.wireValue().equals(value)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown approval decision: " + value);
    }
}
