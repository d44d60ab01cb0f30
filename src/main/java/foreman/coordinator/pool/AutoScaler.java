package foreman.coordinator.pool;

import foreman.coordinator.exception.ScaleLimitExceededException;
import foreman.coordinator.exception.WorkerNotFoundException;
import foreman.coordinator.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sizes the pool to the queue depth, between the configured floor and ceiling.
 * Never stops a busy worker: only idle ones, most recently idle first.
 */
public class AutoScaler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AutoScaler.class);

    private final WorkerPool pool;
    private final int targetTasksPerWorker;

    public AutoScaler(WorkerPool pool, int targetTasksPerWorker) {
        if (targetTasksPerWorker < 1) {
            throw new IllegalArgumentException("targetTasksPerWorker must be >= 1");
        }
        this.pool = pool;
        this.targetTasksPerWorker = targetTasksPerWorker;
    }

    /**
     * {@code min(ceiling, max(floor, ceil(queueDepth / tasksPerWorker)))}
     */
    public static int desiredWorkers(int queueDepth, int ceiling, int floor, int tasksPerWorker) {
        int byDepth = (queueDepth + tasksPerWorker - 1) / tasksPerWorker;
        return Math.min(ceiling, Math.max(floor, byDepth));
    }

    @Override
    public void run() {
        reconcile();
    }

    /**
     * One scaling pass. Running it again with the same depth and pool size does nothing.
     */
    public ScaleDecision reconcile() {
        int depth = pool.queueDepth();
        int current = pool.liveCount();
        int desired = desiredWorkers(depth, pool.ceiling(), pool.floor(), targetTasksPerWorker);

        List<String> spawned = new ArrayList<>();
        List<String> stopped = new ArrayList<>();

        if (desired > current) {
            for (int i = current; i < desired; i++) {
                try {
                    spawned.add(pool.spawn().id());
                } catch (ScaleLimitExceededException e) {
                    log.warn("Scale up stopped early: {}", e.getMessage());
                    break;
                }
            }
        } else if (desired < current) {
            int excess = current - desired;
            for (Worker idle : pool.idleWorkers()) {
                if (stopped.size() >= excess) {
                    break;
                }
                try {
                    pool.stop(idle.id());
                    stopped.add(idle.id());
                } catch (WorkerNotFoundException e) {
                    // stopped concurrently by the health check or the API
                    log.debug("Worker {} already gone", idle.id());
                }
            }
        }

        ScaleDecision decision = new ScaleDecision(depth, current, desired, spawned, stopped);
        if (!decision.isNoop()) {
            log.info("Auto-scale: depth={}, workers {} -> {} (spawned {}, stopped {})",
                    depth, current, pool.liveCount(), spawned, stopped);
        }
        return decision;
    }
}
