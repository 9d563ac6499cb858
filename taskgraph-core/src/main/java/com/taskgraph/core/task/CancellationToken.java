package com.taskgraph.core.task;

import com.taskgraph.core.exception.TaskCancelledException;
import com.taskgraph.core.exception.TaskGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal handed to every task invocation.
 *
 * <p>The solver checks the token before and after each call. Long-running tasks should
 * poll {@link #isCancelled()}, call {@link #throwIfCancelled()} between steps, or
 * register a callback with {@link #onCancel(Runnable)}.</p>
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicReference<TaskGraphException> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * Signal cancellation. Only the first reason is kept; callbacks run once on the calling thread.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(TaskGraphException cause) {
        if (!reason.compareAndSet(null, cause)) {
            return false;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            if (!callbacks.remove(callback)) {
                continue;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * The error the token was cancelled with, or null.
     */
    public TaskGraphException getReason() {
        return reason.get();
    }

    /**
     * @throws TaskCancelledException if the token has been cancelled
     */
    public void throwIfCancelled() {
        TaskGraphException cause = reason.get();
        if (cause != null) {
            throw new TaskCancelledException(cause);
        }
    }

    /**
     * Run the callback on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * Block until cancelled or the timeout elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }
}
