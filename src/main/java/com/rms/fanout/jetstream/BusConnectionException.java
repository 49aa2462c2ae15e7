package com.rms.fanout.jetstream;

/**
 * The bus stayed unreachable for the whole retry budget of an operation.
 */
public class BusConnectionException extends RuntimeException {

    public BusConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
