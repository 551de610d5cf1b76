package forkpool.local.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal handed down the launch chain of a pooled task.
 *
 * Hooks registered before {@link #cancel()} run once when it is called;
 * hooks registered afterwards run immediately on the registering thread.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CopyOnWriteArrayList<Runnable> hooks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a hook to run on cancellation.
     */
    public void onCancelled(Runnable hook) {
        hooks.add(hook);
        // the remove() claims the hook, so a concurrent cancel() cannot run it twice
        if (cancelled.get() && hooks.remove(hook)) {
            runHook(hook);
        }
    }

    /**
     * Signal cancellation.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable hook : hooks) {
            if (hooks.remove(hook)) {
                runHook(hook);
            }
        }
        return true;
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (Exception e) {
            log.warn("Cancellation hook failed: {}", e.getMessage(), e);
        }
    }
}
