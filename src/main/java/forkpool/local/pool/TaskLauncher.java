package forkpool.local.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Starts the work of an admitted task.
 *
 * Called by the pool once the task holds a slot. Implementations must register
 * a kill hook on the token so that cancelling a running task fails the returned
 * future; the slot is released only when that future completes.
 */
@FunctionalInterface
public interface TaskLauncher {

    CompletableFuture<Void> launch(CancellationToken token) throws Exception;
}
