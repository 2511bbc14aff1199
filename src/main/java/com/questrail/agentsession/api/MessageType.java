package com.questrail.agentsession.api;

/**
 * Kind of conversation entry.
 */
public enum MessageType {
    USER,
    ASSISTANT,
    THINKING,
    TOOL,
    TOOL_RESULT
}
