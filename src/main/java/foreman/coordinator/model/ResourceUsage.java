package foreman.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource counters: tokens consumed, money spent, wall time.
 * Used both per task (in a result) and cumulatively per worker.
 */
public record ResourceUsage(
        @JsonProperty("tokens") long tokens,
        @JsonProperty("cost_usd") double costUsd,
        @JsonProperty("runtime_ms") long runtimeMs) {

    public static final ResourceUsage NONE = new ResourceUsage(0, 0.0, 0);

    public ResourceUsage plus(ResourceUsage other) {
        if (other == null) {
            return this;
        }
        return new ResourceUsage(tokens + other.tokens, costUsd + other.costUsd, runtimeMs + other.runtimeMs);
    }
}
