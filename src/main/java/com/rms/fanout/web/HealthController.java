package com.rms.fanout.web;

import com.rms.fanout.cache.EventCacheManager;
import com.rms.fanout.core.lifecycle.TaskSupervisor;
import com.rms.fanout.ingest.AgentEventListener;
import com.rms.fanout.jetstream.admin.JetStreamStatusChecker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Liveness of the fan-out pipeline, not just of the process.
 *
 * <p>UP (200) requires the cache manager to be running with all of its long-running tasks alive, and the
 * ingestion listener (when enabled) to be alive. Otherwise DOWN (503). The JetStream checker is reported
 * for operators but does not decide the status; the bus client retries on its own.</p>
 */
@RestController
public class HealthController {

    private final EventCacheManager cache;
    private final ObjectProvider<AgentEventListener> ingestion;
    private final JetStreamStatusChecker jetStreamChecker;

    public HealthController(EventCacheManager cache, ObjectProvider<AgentEventListener> ingestion,
                            JetStreamStatusChecker jetStreamChecker) {
        this.cache = cache;
        this.ingestion = ingestion;
        this.jetStreamChecker = jetStreamChecker;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<HealthReport>> health() {
        return Mono.fromCallable(jetStreamChecker::check)
                .subscribeOn(Schedulers.boundedElastic())
                .map(jetStream -> {
                    AgentEventListener listener = ingestion.getIfAvailable();
                    Boolean ingestionAlive = listener == null ? null : listener.isAlive();
                    boolean up = cache.isHealthy() && (ingestionAlive == null || ingestionAlive);

                    HealthReport report = new HealthReport(
                            up ? "UP" : "DOWN",
                            cache.state().name(),
                            cache.taskStatus(),
                            ingestionAlive,
                            jetStream);
                    return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(report);
                });
    }

    /**
     * @param ingestionAlive {@code null} when ingestion is disabled on this instance
     */
    public record HealthReport(String status,
                               String cacheState,
                               Map<String, TaskSupervisor.TaskState> cacheTasks,
                               Boolean ingestionAlive,
                               JetStreamStatusChecker.JetStreamStatus jetStream) {
    }
}
