package com.rms.fanout.core.codec;

/**
 * Raised when a payload cannot be turned into a {@link com.rms.fanout.core.model.DomainEvent}.
 *
 * <p>Always recoverable: callers log it and drop the single offending item.</p>
 */
public class InvalidEventException extends RuntimeException {

    public InvalidEventException(String message) {
        super(message);
    }

    public InvalidEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
