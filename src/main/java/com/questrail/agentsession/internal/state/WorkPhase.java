package com.questrail.agentsession.internal.state;

import com.questrail.agentsession.api.ApprovalType;
import com.questrail.agentsession.api.WorkStatus;

import java.util.List;
import java.util.Objects;

/**
 * WorkPhase
 * -----------------------------------------------------------------------------
 * The state of the per-session state machine.
 *
 * <p>The set of phases is closed: every {@link SessionState} is in exactly one
 * of {@link Idle}, {@link Working}, {@link AwaitingApproval} or {@link Ended}.
 * {@link AwaitingApproval} can only be constructed with a non-blank request
 * identifier.</p>
 */
public sealed interface WorkPhase
{
    /**
     * Projects this phase onto the wire-level {@link WorkStatus}.
     */
    WorkStatus toWorkStatus();

    static WorkPhase idle() {
        return Idle.INSTANCE;
    }

    static WorkPhase working() {
        return Working.INSTANCE;
    }

    /** Waiting for the user. */
    final class Idle implements WorkPhase {
        private static final Idle INSTANCE = new Idle();

        private Idle() {}

        @Override
        public WorkStatus toWorkStatus() {
            return WorkStatus.WAITING;
        }

        @Override
        public String toString() {
            return "Idle";
        }
    }

    /** A turn (or an undo/compaction/rollback) is running. */
    final class Working implements WorkPhase {
        private static final Working INSTANCE = new Working();

        private Working() {}

        @Override
        public WorkStatus toWorkStatus() {
            return WorkStatus.WORKING;
        }

        @Override
        public String toString() {
            return "Working";
        }
    }

    /**
     * Blocked on an approval or question.
     */
    record AwaitingApproval(String requestId,
                            ApprovalType approvalType,
                            List<String> proposedAmendment) implements WorkPhase
    {
        public AwaitingApproval {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(approvalType, "approvalType");
            if (requestId.isBlank()) {
                throw new IllegalArgumentException("requestId must not be blank");
            }
            proposedAmendment = proposedAmendment == null ? null : List.copyOf(proposedAmendment);
        }

        @Override
        public WorkStatus toWorkStatus() {
            return approvalType == ApprovalType.QUESTION ? WorkStatus.QUESTION : WorkStatus.PERMISSION;
        }
    }

    /** Terminal until resumed. */
    record Ended(String reason) implements WorkPhase
    {
        public Ended {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public WorkStatus toWorkStatus() {
            return WorkStatus.ENDED;
        }
    }
}
