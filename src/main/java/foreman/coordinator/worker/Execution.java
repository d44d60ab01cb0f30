package foreman.coordinator.worker;

import foreman.coordinator.model.Outcome;
import foreman.coordinator.model.ResourceUsage;

import java.util.Objects;

/**
 * What a {@link TaskExecutor} reports back for one task.
 */
public record Execution(Outcome outcome, String detail, ResourceUsage usage) {

    public Execution {
        Objects.requireNonNull(outcome, "outcome is required");
        usage = usage != null ? usage : ResourceUsage.NONE;
    }

    public static Execution completed(String detail) {
        return new Execution(Outcome.COMPLETED, detail, ResourceUsage.NONE);
    }

    public static Execution failed(String detail) {
        return new Execution(Outcome.FAILED, detail, ResourceUsage.NONE);
    }

    public Execution withUsage(ResourceUsage usage) {
        return new Execution(outcome, detail, usage);
    }
}
