package foreman.coordinator.worker;

import foreman.coordinator.model.ResourceUsage;
import foreman.coordinator.model.TaskPayload;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in executor for local runs: sleeps, then completes or fails at random,
 * reporting made-up token usage priced per model-agnostic rate.
 */
public final class SimulatedTaskExecutor implements TaskExecutor {

    private static final double USD_PER_1K_TOKENS = 0.002;

    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;

    public SimulatedTaskExecutor(int delayMinMs, int delayMaxMs, double failRate) {
        if (delayMinMs < 0 || delayMaxMs < delayMinMs) {
            throw new IllegalArgumentException("delay range must satisfy 0 <= min <= max");
        }
        if (failRate < 0 || failRate > 1) {
            throw new IllegalArgumentException("failRate must be within 0..1");
        }
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    @Override
    public Execution execute(TaskPayload task, WorkerSpec worker) throws InterruptedException {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int delay = delayMinMs >= delayMaxMs ? delayMinMs : random.nextInt(delayMinMs, delayMaxMs);
        Thread.sleep(delay);

        long tokens = random.nextLong(500, 5000);
        ResourceUsage usage = new ResourceUsage(tokens, tokens / 1000.0 * USD_PER_1K_TOKENS, delay);

        boolean shouldFail = failRate > 0 && random.nextDouble() < failRate;
        if (shouldFail) {
            return Execution.failed("Simulated failure on branch " + task.branch()).withUsage(usage);
        }
        String detail = String.format("{\"sim\":true,\"model\":\"%s\",\"files\":%d}",
                worker.model(), task.targetPaths().size());
        return Execution.completed(detail).withUsage(usage);
    }
}
