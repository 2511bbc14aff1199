package com.questrail.agentsession.api;

/**
 * Coarse lifecycle status of a session as shown in list views.
 */
public enum SessionStatus {
    ACTIVE,
    ENDED
}
