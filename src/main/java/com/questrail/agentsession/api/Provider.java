package com.questrail.agentsession.api;

/**
 * Agent runtime family backing a session.
 */
public enum Provider {
    CLAUDE,
    CODEX
}
