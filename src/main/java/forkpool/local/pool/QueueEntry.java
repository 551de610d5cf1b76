package forkpool.local.pool;

import forkpool.local.model.TaskHandle;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted task as owned by the pool: the handle, its launcher, the
 * cancellation token handed to the launcher and the caller's future.
 * Identity is the pool-assigned sequence number.
 */
final class QueueEntry<C> {
    private final TaskHandle<C> handle;
    private final long sequence;
    private final TaskLauncher launcher;
    private final CancellationToken token = new CancellationToken();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    QueueEntry(TaskHandle<C> handle, long sequence, TaskLauncher launcher) {
        this.handle = handle;
        this.sequence = sequence;
        this.launcher = launcher;
    }

    TaskHandle<C> handle() {
        return handle;
    }

    long sequence() {
        return sequence;
    }

    TaskLauncher launcher() {
        return launcher;
    }

    CancellationToken token() {
        return token;
    }

    CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "QueueEntry{seq=" + sequence + ", task=" + handle.id() + "}";
    }
}
