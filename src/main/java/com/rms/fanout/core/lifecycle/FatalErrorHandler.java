package com.rms.fanout.core.lifecycle;

/**
 * Invoked by a liveness-critical component that cannot continue. Continuing would silently stop event
 * delivery, so implementations are expected to bring the process down.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatalError(String component, Throwable cause);
}
