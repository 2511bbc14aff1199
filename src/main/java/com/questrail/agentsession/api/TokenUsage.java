package com.questrail.agentsession.api;

/**
 * Token counters reported by the agent runtime.
 */
public record TokenUsage(long inputTokens,
                         long outputTokens,
                         long cachedTokens,
                         long contextWindow)
{
    private static final TokenUsage EMPTY = new TokenUsage(0, 0, 0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || cachedTokens < 0 || contextWindow < 0) {
            throw new IllegalArgumentException("token counters must be >= 0");
        }
    }

    public static TokenUsage empty() {
        return EMPTY;
    }

    /**
     * Percentage of the context window filled by input tokens.
     */
    public double contextFillPercent() {
        if (contextWindow == 0) {
            return 0.0;
        }
        return (double) inputTokens / contextWindow * 100.0;
    }

    /**
     * Percentage of input tokens served from cache.
     */
    public double cacheHitPercent() {
        if (inputTokens == 0) {
            return 0.0;
        }
        return (double) cachedTokens / inputTokens * 100.0;
    }
}
