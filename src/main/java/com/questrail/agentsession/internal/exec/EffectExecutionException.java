package com.questrail.agentsession.internal.exec;

/**
 * Raised when an effect could not be carried out synchronously, for example
 * because the persistence channel is saturated or an event failed to encode.
 */
public class EffectExecutionException extends Exception
{
    public EffectExecutionException(String message) {
        super(message);
    }

    public EffectExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
