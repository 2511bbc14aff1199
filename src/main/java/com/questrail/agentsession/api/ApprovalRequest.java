package com.questrail.agentsession.api;

import java.util.List;
import java.util.Objects;

/**
 * A pending request for user approval (or an answer to a question).
 *
 * @param proposedAmendment optional command prefix the runtime proposes to
 *                          allow for the rest of the session
 */
public record ApprovalRequest(String id,
                              String sessionId,
                              ApprovalType type,
                              String command,
                              String filePath,
                              String diff,
                              String question,
                              List<String> proposedAmendment)
{
    public ApprovalRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (id.isBlank()) {
            throw new IllegalArgumentException("approval request id must not be blank");
        }
        proposedAmendment = proposedAmendment == null ? null : List.copyOf(proposedAmendment);
    }
}
