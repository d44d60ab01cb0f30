package foreman.coordinator.decompose;

import foreman.coordinator.model.TaskDescription;

import java.util.List;

/**
 * Default decomposer: JSON plans go to {@link JsonPlanDecomposer}, prose to {@link LineItemDecomposer}.
 */
public final class GoalDecomposer implements Decomposer {

    private final Decomposer plans;
    private final Decomposer prose;

    public GoalDecomposer() {
        this(new JsonPlanDecomposer(), new LineItemDecomposer());
    }

    public GoalDecomposer(Decomposer plans, Decomposer prose) {
        this.plans = plans;
        this.prose = prose;
    }

    @Override
    public List<TaskDescription> decompose(String goal) {
        return JsonPlanDecomposer.looksLikePlan(goal) ? plans.decompose(goal) : prose.decompose(goal);
    }
}
