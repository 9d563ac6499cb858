package com.taskgraph.engine.solver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DeadlineWatcherTest {

    private final DeadlineWatcher watcher = new DeadlineWatcher("deadline-test");

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void schedule_shouldFireAfterDeadline() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        watcher.schedule(UUID.randomUUID(), Duration.ofMillis(20), fired::countDown);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(watcher.pending()).isZero();
    }

    @Test
    void cancel_shouldPreventFiring() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        UUID batchId = UUID.randomUUID();

        watcher.schedule(batchId, Duration.ofMillis(200), fired::countDown);
        assertThat(watcher.pending()).isEqualTo(1);
        watcher.cancel(batchId);

        assertThat(fired.await(400, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(watcher.pending()).isZero();
    }
}
