package forkpool.local.pool;

import forkpool.local.error.LaunchFailureException;
import forkpool.local.error.TaskCancelledException;
import forkpool.local.error.TaskExecutionException;
import forkpool.local.model.TaskHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process admission control for local tasks.
 *
 * Waiting entries are ordered by {@code (context, jobId, arrival)}: the context
 * by the comparator given at construction, job ids by natural order (absent ids
 * first), arrival order last, so no two entries ever compare equal.
 *
 * Both collections are guarded by one lock. Admission runs on whichever thread
 * submits a task or completes one; launchers are always invoked outside the lock.
 */
public class LocalExecutionPool<C> implements ExecutionPool<C> {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionPool.class);

    private final int capacity;
    private final ReentrantLock stateLock = new ReentrantLock();
    private final Set<QueueEntry<C>> running = new LinkedHashSet<>();
    private final TreeSet<QueueEntry<C>> waiting;
    private final Map<String, QueueEntry<C>> entriesById = new HashMap<>();

    private final AtomicLong sequence = new AtomicLong();
    // Drain loop guard: non-zero while a thread is admitting; extra requests make it loop again
    private final AtomicInteger drainRequests = new AtomicInteger();

    public LocalExecutionPool(int capacity, Comparator<? super C> contextOrdering) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        Objects.requireNonNull(contextOrdering, "contextOrdering is required");
        this.capacity = capacity;
        this.waiting = new TreeSet<>(Comparator
                .<QueueEntry<C>, C>comparing(e -> e.handle().context(), contextOrdering)
                .thenComparing(e -> e.handle().jobId(), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .thenComparingLong(QueueEntry::sequence));
    }

    /**
     * Pool whose contexts are ordered by their natural order.
     */
    public static <C extends Comparable<? super C>> LocalExecutionPool<C> withNaturalOrder(int capacity) {
        return new LocalExecutionPool<>(capacity, Comparator.<C>naturalOrder());
    }

    @Override
    public CompletableFuture<Void> submit(TaskHandle<C> handle, TaskLauncher launcher) {
        Objects.requireNonNull(handle, "handle is required");
        Objects.requireNonNull(launcher, "launcher is required");

        QueueEntry<C> entry = new QueueEntry<>(handle, sequence.getAndIncrement(), launcher);

        stateLock.lock();
        try {
            if (entriesById.containsKey(handle.id())) {
                throw new IllegalArgumentException("Task " + handle.id() + " is already in the pool");
            }
            entriesById.put(handle.id(), entry);
            waiting.add(entry);
        } finally {
            stateLock.unlock();
        }
        log.debug("Task {} queued (job {})", handle.id(), handle.jobId());

        runNext();
        return entry.completion();
    }

    @Override
    public boolean cancel(TaskHandle<C> handle) {
        Objects.requireNonNull(handle, "handle is required");

        QueueEntry<C> entry;
        boolean wasWaiting;
        stateLock.lock();
        try {
            entry = entriesById.get(handle.id());
            if (entry == null) {
                return false;
            }
            wasWaiting = waiting.remove(entry);
            if (wasWaiting) {
                entriesById.remove(handle.id());
            }
        } finally {
            stateLock.unlock();
        }

        entry.token().cancel();
        if (wasWaiting) {
            entry.completion().completeExceptionally(
                    new TaskCancelledException("Task " + handle.id() + " cancelled while waiting"));
            log.info("Task {} cancelled while waiting", handle.id());
        } else {
            log.info("Task {} cancellation requested while running", handle.id());
        }
        return true;
    }

    @Override
    public List<TaskHandle<C>> listRunning() {
        stateLock.lock();
        try {
            return snapshot(running);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<TaskHandle<C>> listWaiting() {
        stateLock.lock();
        try {
            return snapshot(waiting);
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int runningCount() {
        stateLock.lock();
        try {
            return running.size();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int waitingCount() {
        stateLock.lock();
        try {
            return waiting.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Admit waiting entries until the pool is full or nothing is waiting.
     * Re-entrant calls (a launcher whose future completes synchronously) only
     * bump the request counter, so cascades never grow the stack.
     */
    private void runNext() {
        if (drainRequests.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        for (;;) {
            QueueEntry<C> next;
            while ((next = admitNext()) != null) {
                launch(next);
            }
            missed = drainRequests.addAndGet(-missed);
            if (missed == 0) {
                return;
            }
        }
    }

    /**
     * Move the first waiting entry to the running set if a slot is free.
     *
     * @return the promoted entry, or null if nothing changed
     */
    private QueueEntry<C> admitNext() {
        stateLock.lock();
        try {
            if (running.size() >= capacity || waiting.isEmpty()) {
                return null;
            }
            QueueEntry<C> next = waiting.pollFirst();
            running.add(next);
            return next;
        } finally {
            stateLock.unlock();
        }
    }

    private void launch(QueueEntry<C> entry) {
        String taskId = entry.handle().id();
        log.debug("Task {} admitted ({} of {} slots)", taskId, runningCount(), capacity);

        CompletableFuture<Void> launched;
        try {
            launched = entry.launcher().launch(entry.token());
            if (launched == null) {
                launched = CompletableFuture.failedFuture(
                        new LaunchFailureException("Launcher of task " + taskId + " returned no future", null));
            }
        } catch (TaskExecutionException e) {
            launched = CompletableFuture.failedFuture(e);
        } catch (Throwable t) {
            launched = CompletableFuture.failedFuture(
                    new LaunchFailureException("Failed to launch task " + taskId + ": " + t.getMessage(), t));
        }

        launched.whenComplete((ignored, failure) -> onFinished(entry, failure));
    }

    private void onFinished(QueueEntry<C> entry, Throwable failure) {
        String taskId = entry.handle().id();

        boolean released;
        stateLock.lock();
        try {
            released = running.remove(entry);
            if (released) {
                entriesById.remove(taskId);
            }
        } finally {
            stateLock.unlock();
        }

        if (!released) {
            IllegalStateException fault = new IllegalStateException(
                    "Finished task " + taskId + " was not in the running set");
            log.error("Pool state corrupted", fault);
            entry.completion().completeExceptionally(fault);
        } else if (failure == null) {
            log.debug("Task {} completed", taskId);
            entry.completion().complete(null);
        } else {
            Throwable cause = unwrap(failure);
            log.debug("Task {} failed: {}", taskId, cause.getMessage());
            entry.completion().completeExceptionally(cause);
        }

        runNext();
    }

    private static <C> List<TaskHandle<C>> snapshot(Iterable<QueueEntry<C>> entries) {
        List<TaskHandle<C>> handles = new ArrayList<>();
        for (QueueEntry<C> entry : entries) {
            handles.add(entry.handle());
        }
        return List.copyOf(handles);
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
