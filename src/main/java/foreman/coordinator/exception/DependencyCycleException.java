package foreman.coordinator.exception;

import java.util.List;

/**
 * Accepting a task would make the dependency graph cyclic.
 */
public class DependencyCycleException extends CoordinatorException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Task ids along the cycle, first id repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
