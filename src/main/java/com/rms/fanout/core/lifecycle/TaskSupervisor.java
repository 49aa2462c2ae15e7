package com.rms.fanout.core.lifecycle;

import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns a group of named background tasks.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Keeps a handle per task so liveness can be reported (a silently dead task means missed events).</li>
 *   <li>Distinguishes long-running tasks, which must stay alive, from one-shot tasks, which may complete.</li>
 *   <li>Cancels tasks in reverse launch order on shutdown.</li>
 * </ul>
 *
 * <p>Thread-safe. A task name can be launched once per supervisor lifetime; relaunch after
 * {@link #cancelAll()}.</p>
 */
public class TaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    public enum TaskState { RUNNING, COMPLETED, FAILED, CANCELLED }

    private final String group;
    private final Map<String, Task> tasks = new LinkedHashMap<>();

    public TaskSupervisor(String group) {
        this.group = group;
    }

    /**
     * Subscribes to a task that is expected to run until cancelled. Completion or failure makes the
     * supervisor report not-alive.
     */
    public Disposable launch(String name, Publisher<?> body) {
        return start(name, body, false);
    }

    /**
     * Subscribes to a task that is expected to complete (e.g. a startup backfill). Only a failure is
     * reported; completion is normal.
     */
    public Disposable launchOneShot(String name, Publisher<?> body) {
        return start(name, body, true);
    }

    private Disposable start(String name, Publisher<?> body, boolean oneShot) {
        Task task = new Task(name, oneShot);
        synchronized (tasks) {
            Task existing = tasks.get(name);
            if (existing != null && existing.state == TaskState.RUNNING) {
                throw new IllegalStateException("Task already running: " + group + "/" + name);
            }
            tasks.put(name, task);
        }

        log.info("Starting task {}/{}", group, name);
        task.handle = Flux.from(body)
                .doFinally(signal -> task.finish(signal))
                .subscribe(
                        v -> { },
                        err -> log.error("Task {}/{} failed: {}", group, name, err.toString(), err),
                        () -> {
                            if (oneShot) {
                                log.info("Task {}/{} completed", group, name);
                            } else {
                                log.warn("Long-running task {}/{} completed unexpectedly", group, name);
                            }
                        });
        return task.handle;
    }

    /**
     * @return {@code true} when at least one task was launched and no long-running task has stopped
     *         and no task has failed
     */
    public boolean allRunning() {
        synchronized (tasks) {
            if (tasks.isEmpty()) {
                return false;
            }
            for (Task t : tasks.values()) {
                if (t.state == TaskState.FAILED) {
                    return false;
                }
                if (!t.oneShot && t.state != TaskState.RUNNING) {
                    return false;
                }
            }
            return true;
        }
    }

    public boolean isAlive(String name) {
        synchronized (tasks) {
            Task t = tasks.get(name);
            return t != null && t.state == TaskState.RUNNING;
        }
    }

    /** Task name to state, in launch order. */
    public Map<String, TaskState> status() {
        synchronized (tasks) {
            Map<String, TaskState> out = new LinkedHashMap<>();
            tasks.forEach((name, t) -> out.put(name, t.state));
            return Collections.unmodifiableMap(out);
        }
    }

    /**
     * Cancels every task, most recently launched first, and forgets them.
     */
    public void cancelAll() {
        List<Task> snapshot;
        synchronized (tasks) {
            snapshot = new ArrayList<>(tasks.values());
            tasks.clear();
        }
        Collections.reverse(snapshot);
        for (Task t : snapshot) {
            Disposable d = t.handle;
            if (d != null && !d.isDisposed()) {
                log.info("Cancelling task {}/{}", group, t.name);
                d.dispose();
            }
        }
    }

    private static final class Task {
        private final String name;
        private final boolean oneShot;
        private volatile TaskState state = TaskState.RUNNING;
        private volatile Disposable handle;

        private Task(String name, boolean oneShot) {
            this.name = name;
            this.oneShot = oneShot;
        }

        private void finish(SignalType signal) {
            state = switch (signal) {
                case ON_ERROR -> TaskState.FAILED;
                case CANCEL -> TaskState.CANCELLED;
                default -> TaskState.COMPLETED;
            };
        }
    }
}
