package com.rms.fanout.core.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the Spring context and exits the JVM with a non-zero status.
 *
 * <p>Runs on its own thread: the caller is typically a Reactor worker that the context shutdown is
 * about to dispose.</p>
 */
@Component
public class ExitingFatalErrorHandler implements FatalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ExitingFatalErrorHandler.class);

    static final int EXIT_CODE = 70;

    private final ConfigurableApplicationContext context;
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    public ExitingFatalErrorHandler(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatalError(String component, Throwable cause) {
        log.error("FATAL: {} cannot continue; shutting down. cause={}", component, String.valueOf(cause), cause);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> EXIT_CODE)),
                "fatal-exit");
        exit.setDaemon(false);
        exit.start();
    }
}
