package foreman.coordinator.pool;

import foreman.coordinator.config.CoordinatorConfig;
import foreman.coordinator.exception.ScaleLimitExceededException;
import foreman.coordinator.exception.WorkerCrashException;
import foreman.coordinator.exception.WorkerNotFoundException;
import foreman.coordinator.model.ResourceUsage;
import foreman.coordinator.model.Worker;
import foreman.coordinator.model.WorkerStatus;
import foreman.coordinator.queue.WorkQueue;
import foreman.coordinator.worker.Heartbeat;
import foreman.coordinator.worker.WorkerHandle;
import foreman.coordinator.worker.WorkerRuntime;
import foreman.coordinator.worker.WorkerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owns the live workers: starts and stops them through the {@link WorkerRuntime},
 * tracks their heartbeats and enforces the concurrency ceiling and cost budget.
 *
 * <p>All methods are synchronized, so a ceiling check and the insertion it guards
 * happen atomically for manual spawns and auto-scaler spawns alike.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private static final class Entry {
        final WorkerHandle handle;
        Worker worker;

        Entry(WorkerHandle handle, Worker worker) {
            this.handle = handle;
            this.worker = worker;
        }
    }

    private final CoordinatorConfig config;
    private final WorkerRuntime runtime;
    private final WorkQueue workQueue;
    private final Clock clock;
    private final Map<String, Entry> workers = new LinkedHashMap<>();
    private long nextWorkerNumber = 1;
    private int modelCursor = 0;
    private ResourceUsage retiredUsage = ResourceUsage.NONE;

    public WorkerPool(CoordinatorConfig config, WorkerRuntime runtime, WorkQueue workQueue) {
        this(config, runtime, workQueue, Clock.systemUTC());
    }

    public WorkerPool(CoordinatorConfig config, WorkerRuntime runtime, WorkQueue workQueue, Clock clock) {
        this.config = config;
        this.runtime = runtime;
        this.workQueue = workQueue;
        this.clock = clock;
    }

    /**
     * Start one worker.
     *
     * @throws ScaleLimitExceededException if the ceiling is reached or the cost budget is spent
     */
    public synchronized Worker spawn() {
        if (workers.size() >= config.maxWorkers()) {
            throw new ScaleLimitExceededException(
                    "Concurrency ceiling reached (" + workers.size() + "/" + config.maxWorkers() + ")");
        }
        refresh(clock.instant());
        CostSummary cost = summarize();
        if (cost.budgetExhausted()) {
            throw new ScaleLimitExceededException(String.format(
                    "Cost budget exhausted ($%.4f of $%.2f)", cost.totalCostUsd(), cost.budgetUsd()));
        }

        String workerId = "worker-" + nextWorkerNumber++;
        List<String> models = config.workerModels();
        String model = models.get(modelCursor++ % models.size());

        WorkerHandle handle = runtime.start(new WorkerSpec(workerId, model));
        Worker worker = Worker.builder()
                .id(workerId)
                .model(model)
                .status(WorkerStatus.STARTING)
                .startedAt(clock.instant())
                .build();
        workers.put(workerId, new Entry(handle, worker));

        log.info("Spawned worker {} (model {}), pool size {}/{}",
                workerId, model, workers.size(), config.maxWorkers());
        return worker;
    }

    /**
     * Gracefully stop a worker and release whatever it was holding back to the scheduler.
     *
     * @return the final record of the worker, status STOPPED
     * @throws WorkerNotFoundException if no live worker has this id
     */
    public synchronized Worker stop(String workerId) {
        Entry entry = workers.get(workerId);
        if (entry == null) {
            throw new WorkerNotFoundException(workerId);
        }
        Worker stopped = remove(entry);
        log.info("Stopped worker {}, pool size {}/{}", workerId, workers.size(), config.maxWorkers());
        return stopped;
    }

    /**
     * One health-check pass: refresh every record from its heartbeat and force-stop
     * the workers that went silent.
     *
     * @return ids of the workers stopped as crashed
     */
    public synchronized List<String> checkHealth() {
        Instant now = clock.instant();
        List<String> crashed = new ArrayList<>();
        for (Entry entry : refresh(now)) {
            Duration silence = Duration.between(lastSign(entry), now);
            WorkerCrashException crash = new WorkerCrashException(entry.worker.id(), silence);
            log.warn("Worker {} unhealthy, force-stopping", entry.worker.id(), crash);
            remove(entry);
            crashed.add(entry.worker.id());
        }
        return crashed;
    }

    /**
     * Idle workers, most recently idle first. Workers holding a delivery are never idle.
     */
    public synchronized List<Worker> idleWorkers() {
        refresh(clock.instant());
        return workers.values().stream()
                .map(e -> e.worker)
                .filter(w -> w.status() == WorkerStatus.IDLE)
                .filter(w -> workQueue.heldBy(w.id()).isEmpty())
                .sorted(Comparator.comparing(Worker::idleSince, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public synchronized Optional<Worker> findById(String workerId) {
        Entry entry = workers.get(workerId);
        return entry != null ? Optional.of(entry.worker) : Optional.empty();
    }

    /** Workers counted against the ceiling */
    public synchronized int liveCount() {
        return workers.size();
    }

    public int ceiling() {
        return config.maxWorkers();
    }

    public int floor() {
        return config.minWorkers();
    }

    public int queueDepth() {
        return workQueue.depth();
    }

    public synchronized PoolSnapshot snapshot() {
        refresh(clock.instant());
        List<Worker> view = workers.values().stream().map(e -> e.worker).toList();
        return new PoolSnapshot(view, workQueue.depth(), config.maxWorkers(), config.minWorkers(), summarize());
    }

    /** Spend of live and retired workers, from the latest heartbeats */
    public synchronized CostSummary costSummary() {
        refresh(clock.instant());
        return summarize();
    }

    @Override
    public synchronized void close() {
        for (Entry entry : List.copyOf(workers.values())) {
            remove(entry);
        }
        log.info("Worker pool closed");
    }

    // ==================== Helpers ====================

    private CostSummary summarize() {
        ResourceUsage total = retiredUsage;
        Map<String, Integer> byModel = new TreeMap<>();
        for (Entry entry : workers.values()) {
            total = total.plus(entry.worker.usage());
            byModel.merge(entry.worker.model(), 1, Integer::sum);
        }
        return new CostSummary(total.costUsd(), total.tokens(), config.costBudgetUsd(), byModel);
    }

    /**
     * Re-derive every record from its heartbeat and the queue's in-flight state.
     * Silent workers are marked UNHEALTHY and returned; the rest become STARTING, IDLE or BUSY.
     */
    private List<Entry> refresh(Instant now) {
        List<Entry> silent = new ArrayList<>();
        for (Entry entry : workers.values()) {
            Optional<Heartbeat> heartbeat = runtime.heartbeat(entry.handle);
            Worker current = entry.worker;
            Worker.Builder next = current.toBuilder()
                    .lastHeartbeat(heartbeat.map(Heartbeat::at).orElse(current.lastHeartbeat()));
            heartbeat.ifPresent(hb -> next
                    .usage(hb.usage())
                    .tasksCompleted(hb.tasksCompleted())
                    .tasksFailed(hb.tasksFailed()));

            Duration silence = Duration.between(lastSign(entry, heartbeat), now);
            Optional<String> held = workQueue.heldBy(current.id());
            if (silence.compareTo(config.heartbeatTimeout()) > 0) {
                next.status(WorkerStatus.UNHEALTHY).currentTaskId(null).idleSince(null);
                silent.add(entry);
            } else if (held.isPresent()) {
                next.status(WorkerStatus.BUSY).currentTaskId(held.get()).idleSince(null);
            } else if (heartbeat.isPresent()) {
                Instant idleSince = current.status() == WorkerStatus.IDLE && current.idleSince() != null
                        ? current.idleSince()
                        : now;
                next.status(WorkerStatus.IDLE).currentTaskId(null).idleSince(idleSince);
            } else {
                next.status(WorkerStatus.STARTING).currentTaskId(null);
            }
            entry.worker = next.build();
        }
        return silent;
    }

    private Instant lastSign(Entry entry) {
        return entry.worker.lastHeartbeat() != null ? entry.worker.lastHeartbeat() : entry.worker.startedAt();
    }

    private Instant lastSign(Entry entry, Optional<Heartbeat> heartbeat) {
        return heartbeat.map(Heartbeat::at).orElseGet(() -> lastSign(entry));
    }

    private Worker remove(Entry entry) {
        String workerId = entry.worker.id();
        workers.remove(workerId);
        runtime.terminate(entry.handle);
        workQueue.release(workerId);
        retiredUsage = retiredUsage.plus(entry.worker.usage());
        return entry.worker.toBuilder().status(WorkerStatus.STOPPED).build();
    }
}
