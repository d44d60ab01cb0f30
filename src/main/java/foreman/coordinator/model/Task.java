package foreman.coordinator.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable task record: one unit of decomposed work and its dependency edges.
 * Updates go through {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final String title;
    private final String instruction;
    private final List<String> targetPaths;
    private final String branch;
    private final Priority priority;
    private final TaskStatus status;
    private final Set<String> dependencies;
    private final int attempts;
    private final int maxAttempts;
    private final String assignedTo; // worker ID or null
    private final String lastError;
    private final String result; // detail from the completing worker
    private final long sequence; // creation order, assigned by the store
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = builder.title != null ? builder.title : builder.id;
        this.instruction = builder.instruction != null ? builder.instruction : "";
        this.targetPaths = List.copyOf(builder.targetPaths);
        this.branch = builder.branch;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.assignedTo = builder.assignedTo;
        this.lastError = builder.lastError;
        this.result = builder.result;
        this.sequence = builder.sequence;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String instruction() {
        return instruction;
    }

    public List<String> targetPaths() {
        return targetPaths;
    }

    public String branch() {
        return branch;
    }

    public Priority priority() {
        return priority;
    }

    public TaskStatus status() {
        return status;
    }

    public Set<String> dependencies() {
        return dependencies;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String assignedTo() {
        return assignedTo;
    }

    public String lastError() {
        return lastError;
    }

    public String result() {
        return result;
    }

    public long sequence() {
        return sequence;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if task can be retried */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    /**
     * Completed or failed. The scheduler re-queues a retryable failure in the same
     * step that records it, so a FAILED task seen at rest is final.
     */
    public boolean isTerminal() {
        return status == TaskStatus.COMPLETED || status == TaskStatus.FAILED;
    }

    /** Wire payload pushed onto the work queue */
    public TaskPayload toPayload() {
        return new TaskPayload(id, title, instruction, branch, targetPaths, priority.wireName());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .instruction(instruction)
                .targetPaths(targetPaths)
                .branch(branch)
                .priority(priority)
                .status(status)
                .dependencies(dependencies)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .assignedTo(assignedTo)
                .lastError(lastError)
                .result(result)
                .sequence(sequence)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String instruction;
        private List<String> targetPaths = List.of();
        private String branch;
        private Priority priority = Priority.MEDIUM;
        private TaskStatus status = TaskStatus.PENDING;
        private Collection<String> dependencies = List.of();
        private int attempts = 0;
        private int maxAttempts = 3;
        private String assignedTo;
        private String lastError;
        private String result;
        private long sequence;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder targetPaths(List<String> targetPaths) {
            this.targetPaths = targetPaths != null ? targetPaths : List.of();
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder dependencies(Collection<String> dependencies) {
            this.dependencies = dependencies != null ? dependencies : List.of();
            return this;
        }

        public Builder dependsOn(String... ids) {
            this.dependencies = List.of(ids);
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", priority=" + priority
                + ", assignedTo='" + assignedTo + "'}";
    }
}
