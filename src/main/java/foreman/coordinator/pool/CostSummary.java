package foreman.coordinator.pool;

import java.util.Map;

/**
 * Pool-wide spend, including workers that have already been stopped.
 *
 * @param budgetUsd 0 when no budget is configured
 */
public record CostSummary(double totalCostUsd, long totalTokens, double budgetUsd, Map<String, Integer> workersByModel) {

    public CostSummary {
        workersByModel = Map.copyOf(workersByModel);
    }

    public boolean budgetExhausted() {
        return budgetUsd > 0 && totalCostUsd >= budgetUsd;
    }
}
