package com.questrail.agentsession.api;

import java.time.Instant;

/**
 * Lightweight description of a session for list views.
 */
public record SessionSummary(String id,
                             Provider provider,
                             String projectPath,
                             String model,
                             String customName,
                             SessionStatus status,
                             WorkStatus workStatus,
                             boolean hasPendingApproval,
                             TokenUsage tokenUsage,
                             int messageCount,
                             Instant startedAt,
                             Instant lastActivityAt,
                             long revision)
{
}
