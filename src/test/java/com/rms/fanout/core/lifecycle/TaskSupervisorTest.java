package com.rms.fanout.core.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskSupervisor")
class TaskSupervisorTest {

    @Test
    @DisplayName("reports long-running tasks alive until they stop")
    void liveness() {
        TaskSupervisor supervisor = new TaskSupervisor("test");

        supervisor.launch("loop", Flux.never());
        supervisor.launchOneShot("once", Mono.just(1));

        assertThat(supervisor.allRunning()).isTrue();
        assertThat(supervisor.isAlive("loop")).isTrue();
        assertThat(supervisor.status())
                .containsEntry("loop", TaskSupervisor.TaskState.RUNNING)
                .containsEntry("once", TaskSupervisor.TaskState.COMPLETED);
    }

    @Test
    @DisplayName("a failed or completed long-running task makes the group unhealthy")
    void deadTask() {
        TaskSupervisor failed = new TaskSupervisor("test");
        failed.launch("loop", Flux.error(new IllegalStateException("boom")));

        TaskSupervisor completed = new TaskSupervisor("test");
        completed.launch("loop", Flux.empty());

        assertThat(failed.allRunning()).isFalse();
        assertThat(failed.status()).containsEntry("loop", TaskSupervisor.TaskState.FAILED);
        assertThat(completed.allRunning()).isFalse();
        assertThat(completed.isAlive("loop")).isFalse();
    }

    @Test
    @DisplayName("a failed one-shot task makes the group unhealthy")
    void failedOneShot() {
        TaskSupervisor supervisor = new TaskSupervisor("test");
        supervisor.launch("loop", Flux.never());
        supervisor.launchOneShot("once", Mono.error(new IllegalStateException("boom")));

        assertThat(supervisor.allRunning()).isFalse();
    }

    @Test
    @DisplayName("cancels in reverse launch order and forgets the tasks")
    void cancelOrder() {
        TaskSupervisor supervisor = new TaskSupervisor("test");
        List<String> cancelled = new CopyOnWriteArrayList<>();
        supervisor.launch("first", Flux.never().doOnCancel(() -> cancelled.add("first")));
        supervisor.launch("second", Flux.never().doOnCancel(() -> cancelled.add("second")));

        supervisor.cancelAll();

        assertThat(cancelled).containsExactly("second", "first");
        assertThat(supervisor.status()).isEmpty();
        assertThat(supervisor.allRunning()).isFalse();
    }

    @Test
    @DisplayName("refuses to launch a task name twice while it runs")
    void duplicateName() {
        TaskSupervisor supervisor = new TaskSupervisor("test");
        supervisor.launch("loop", Flux.never());

        assertThatThrownBy(() -> supervisor.launch("loop", Flux.never()))
                .isInstanceOf(IllegalStateException.class);
    }
}
