package forkpool.local.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable descriptor of one unit of work for the local pool:
 * a shell command plus the priority key {@code (context, jobId)}.
 *
 * @param <C> scheduling context type, ordered by the pool's comparator
 */
public final class TaskHandle<C> {
    private final String id;
    private final String command;
    private final C context;
    private final String jobId;
    private final String executionId; // caller-side execution reference, may be null
    private final Instant submittedAt;

    private TaskHandle(Builder<C> builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.context = Objects.requireNonNull(builder.context, "context is required");
        this.jobId = builder.jobId;
        this.executionId = builder.executionId;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
    }

    // Getters
    public String id() {
        return id;
    }

    public String command() {
        return command;
    }

    public C context() {
        return context;
    }

    public String jobId() {
        return jobId;
    }

    public String executionId() {
        return executionId;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    /** Create a builder from this handle (the copy keeps the id) */
    public Builder<C> toBuilder() {
        return new Builder<C>()
                .id(id)
                .command(command)
                .context(context)
                .jobId(jobId)
                .executionId(executionId)
                .submittedAt(submittedAt);
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public static final class Builder<C> {
        private String id;
        private String command;
        private C context;
        private String jobId;
        private String executionId;
        private Instant submittedAt;

        public Builder<C> id(String id) {
            this.id = id;
            return this;
        }

        public Builder<C> command(String command) {
            this.command = command;
            return this;
        }

        public Builder<C> context(C context) {
            this.context = context;
            return this;
        }

        public Builder<C> jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder<C> executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder<C> submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public TaskHandle<C> build() {
            return new TaskHandle<>(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskHandle<?> handle))
            return false;
        return Objects.equals(id, handle.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskHandle{id='" + id + "', jobId='" + jobId + "', command='" + command + "'}";
    }
}
