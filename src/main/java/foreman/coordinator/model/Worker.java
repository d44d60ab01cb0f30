package foreman.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one worker in the pool.
 * Invariant: {@code currentTaskId} is non-null if and only if status is BUSY.
 */
public final class Worker {
    private final String id;
    private final String model;
    private final WorkerStatus status;
    private final String currentTaskId;
    private final Instant lastHeartbeat;
    private final Instant idleSince;
    private final Instant startedAt;
    private final ResourceUsage usage;
    private final int tasksCompleted;
    private final int tasksFailed;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.model = builder.model;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.currentTaskId = builder.status == WorkerStatus.BUSY
                ? Objects.requireNonNull(builder.currentTaskId, "busy worker needs a current task")
                : null;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.idleSince = builder.idleSince;
        this.startedAt = builder.startedAt;
        this.usage = builder.usage != null ? builder.usage : ResourceUsage.NONE;
        this.tasksCompleted = builder.tasksCompleted;
        this.tasksFailed = builder.tasksFailed;
    }

    public String id() {
        return id;
    }

    public String model() {
        return model;
    }

    public WorkerStatus status() {
        return status;
    }

    public String currentTaskId() {
        return currentTaskId;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant idleSince() {
        return idleSince;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ResourceUsage usage() {
        return usage;
    }

    public int tasksCompleted() {
        return tasksCompleted;
    }

    public int tasksFailed() {
        return tasksFailed;
    }

    public boolean isBusy() {
        return status == WorkerStatus.BUSY;
    }

    /** Counts against the concurrency ceiling */
    public boolean isLive() {
        return status != WorkerStatus.STOPPED;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .model(model)
                .status(status)
                .currentTaskId(currentTaskId)
                .lastHeartbeat(lastHeartbeat)
                .idleSince(idleSince)
                .startedAt(startedAt)
                .usage(usage)
                .tasksCompleted(tasksCompleted)
                .tasksFailed(tasksFailed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String model;
        private WorkerStatus status = WorkerStatus.STARTING;
        private String currentTaskId;
        private Instant lastHeartbeat;
        private Instant idleSince;
        private Instant startedAt;
        private ResourceUsage usage;
        private int tasksCompleted;
        private int tasksFailed;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentTaskId(String currentTaskId) {
            this.currentTaskId = currentTaskId;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder idleSince(Instant idleSince) {
            this.idleSince = idleSince;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder usage(ResourceUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder tasksCompleted(int tasksCompleted) {
            this.tasksCompleted = tasksCompleted;
            return this;
        }

        public Builder tasksFailed(int tasksFailed) {
            this.tasksFailed = tasksFailed;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", model='" + model + "'}";
    }
}
