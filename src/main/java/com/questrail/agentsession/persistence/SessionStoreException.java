package com.questrail.agentsession.persistence;

/**
 * Raised by a {@link SessionStore} when a read or write fails.
 */
public class SessionStoreException extends Exception
{
    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
