package forkpool.local.pool;

import forkpool.local.model.TaskHandle;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Admission-controlled pool: at most {@link #capacity()} tasks run at once,
 * the rest wait in priority order.
 */
public interface ExecutionPool<C> {

    /**
     * Queue a task. The returned future completes when the launched work
     * completes, or fails with a {@code TaskExecutionException}.
     *
     * @throws IllegalArgumentException if a task with the same id is queued or running
     */
    CompletableFuture<Void> submit(TaskHandle<C> handle, TaskLauncher launcher);

    /**
     * Cancel a task. A waiting task is dropped at once and its future fails;
     * a running task has its cancellation token triggered.
     *
     * @return false if the task is unknown to the pool
     */
    boolean cancel(TaskHandle<C> handle);

    /** Snapshot of running tasks */
    List<TaskHandle<C>> listRunning();

    /** Snapshot of waiting tasks, in admission order */
    List<TaskHandle<C>> listWaiting();

    int capacity();

    int runningCount();

    int waitingCount();
}
