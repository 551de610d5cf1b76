package forkpool.local.model;

/**
 * Position of a task inside the local pool.
 */
public enum TaskStatus {
    /** Queued, waiting for a free slot */
    WAITING,
    /** Admitted, its process has been launched */
    RUNNING
}
