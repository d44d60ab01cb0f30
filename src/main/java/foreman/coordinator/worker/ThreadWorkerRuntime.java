package foreman.coordinator.worker;

import foreman.coordinator.queue.ResultChannel;
import foreman.coordinator.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs each worker as a daemon thread in this JVM.
 * A pump thread stamps a heartbeat for every worker whose thread is still alive,
 * so a thread that dies stops beating and is caught by the pool's health check.
 */
public final class ThreadWorkerRuntime implements WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerRuntime.class);

    private static final class Slot {
        final WorkerLoop loop;
        final Thread thread;
        volatile Instant lastBeat;

        Slot(WorkerLoop loop, Thread thread) {
            this.loop = loop;
            this.thread = thread;
        }
    }

    private final WorkQueue workQueue;
    private final ResultChannel results;
    private final TaskExecutor executor;
    private final Duration pollTimeout;
    private final Clock clock;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final ScheduledExecutorService pump;

    public ThreadWorkerRuntime(WorkQueue workQueue,
            ResultChannel results,
            TaskExecutor executor,
            Duration pollTimeout,
            Duration heartbeatInterval) {
        this(workQueue, results, executor, pollTimeout, heartbeatInterval, Clock.systemUTC());
    }

    public ThreadWorkerRuntime(WorkQueue workQueue,
            ResultChannel results,
            TaskExecutor executor,
            Duration pollTimeout,
            Duration heartbeatInterval,
            Clock clock) {
        this.workQueue = workQueue;
        this.results = results;
        this.executor = executor;
        this.pollTimeout = pollTimeout;
        this.clock = clock;
        this.pump = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "foreman-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = heartbeatInterval.toMillis();
        pump.scheduleAtFixedRate(this::beat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public WorkerHandle start(WorkerSpec spec) {
        WorkerLoop loop = new WorkerLoop(spec, workQueue, results, executor, pollTimeout);
        Thread thread = new Thread(loop, "worker-" + spec.workerId());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Worker thread {} died", t.getName(), e));

        slots.put(spec.workerId(), new Slot(loop, thread));
        thread.start();
        return new WorkerHandle(spec.workerId(), spec.model(), thread.getName());
    }

    @Override
    public void terminate(WorkerHandle handle) {
        Slot slot = slots.remove(handle.workerId());
        if (slot == null) {
            return;
        }
        slot.loop.stop();
        slot.thread.interrupt();
        try {
            slot.thread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (slot.thread.isAlive()) {
            log.warn("Worker {} did not stop within 1s", handle.workerId());
        }
    }

    @Override
    public Optional<Heartbeat> heartbeat(WorkerHandle handle) {
        Slot slot = slots.get(handle.workerId());
        if (slot == null || slot.lastBeat == null) {
            return Optional.empty();
        }
        WorkerLoop loop = slot.loop;
        return Optional.of(new Heartbeat(slot.lastBeat, loop.usage(), loop.tasksCompleted(), loop.tasksFailed()));
    }

    /** Number of worker threads still alive */
    public int aliveCount() {
        return (int) slots.values().stream().filter(s -> s.thread.isAlive()).count();
    }

    private void beat() {
        Instant now = clock.instant();
        for (Slot slot : slots.values()) {
            if (slot.thread.isAlive()) {
                slot.lastBeat = now;
            }
        }
    }

    @Override
    public void close() {
        for (String workerId : Map.copyOf(slots).keySet()) {
            Slot slot = slots.get(workerId);
            if (slot != null) {
                terminate(new WorkerHandle(workerId, slot.loop.spec().model(), slot.thread.getName()));
            }
        }
        pump.shutdownNow();
        log.info("Worker runtime closed");
    }
}
