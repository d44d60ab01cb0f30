package foreman.coordinator.pool;

import foreman.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background pool upkeep on one scheduled thread:
 * - health check: force-stops workers that missed their heartbeats
 * - auto-scaler: sizes the pool to the queue depth
 *
 * Independent of the scheduler loop.
 */
public class PoolMaintenance implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PoolMaintenance.class);

    private final ScheduledExecutorService executor;
    private final WorkerPool pool;
    private final AutoScaler autoScaler;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public PoolMaintenance(WorkerPool pool, AutoScaler autoScaler, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "foreman-pool");
            t.setDaemon(true);
            return t;
        });
        this.pool = pool;
        this.autoScaler = autoScaler;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Pool maintenance already running");
            return;
        }

        running = true;

        long healthIntervalMs = config.healthCheckInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("health-check", pool::checkHealth),
                healthIntervalMs,
                healthIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Health check scheduled every {}ms", healthIntervalMs);

        long scaleIntervalMs = config.autoScaleInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("auto-scaler", autoScaler),
                0,
                scaleIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Auto-scaler scheduled every {}ms", scaleIntervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Pool maintenance forcefully stopped");
            } else {
                log.info("Pool maintenance stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One failing tick must not cancel the schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
