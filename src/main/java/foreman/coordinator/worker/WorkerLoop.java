package foreman.coordinator.worker;

import foreman.coordinator.model.Outcome;
import foreman.coordinator.model.ResourceUsage;
import foreman.coordinator.model.TaskPayload;
import foreman.coordinator.model.TaskResult;
import foreman.coordinator.queue.ResultChannel;
import foreman.coordinator.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Body of one in-process worker.
 * Loops: take → execute → publish result → acknowledge.
 * Stops cleanly on {@link #stop()} or Thread.interrupt().
 */
public final class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    private final WorkerSpec spec;
    private final WorkQueue workQueue;
    private final ResultChannel results;
    private final TaskExecutor executor;
    private final Duration pollTimeout;

    private final AtomicReference<ResourceUsage> usage = new AtomicReference<>(ResourceUsage.NONE);
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile boolean running = true;
    private volatile String currentTaskId;

    public WorkerLoop(WorkerSpec spec,
            WorkQueue workQueue,
            ResultChannel results,
            TaskExecutor executor,
            Duration pollTimeout) {
        this.spec = spec;
        this.workQueue = workQueue;
        this.results = results;
        this.executor = executor;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public void run() {
        log.info("Worker {} started (model {})", spec.workerId(), spec.model());

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                // 1. Take one task; empty means the queue stayed empty for the whole timeout
                Optional<WorkQueue.Delivery> delivery = workQueue.take(spec.workerId(), pollTimeout);
                if (delivery.isEmpty()) {
                    continue;
                }

                TaskPayload task = delivery.get().payload();
                currentTaskId = task.id();

                // 2. Execute
                Execution execution = execute(task);

                // 3. Report, then consume the delivery
                record(execution);
                results.publish(toResult(task, execution));
                workQueue.acknowledge(task.id(), spec.workerId());
                currentTaskId = null;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.info("Worker {} stopped", spec.workerId());
    }

    private Execution execute(TaskPayload task) throws InterruptedException {
        long started = System.nanoTime();
        try {
            Execution execution = executor.execute(task, spec);
            return execution != null ? execution : Execution.failed("executor returned no result");
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            log.warn("Worker {} failed task {}: {}", spec.workerId(), task.id(), e.getMessage());
            return Execution.failed(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .withUsage(new ResourceUsage(0, 0.0, elapsedMs));
        }
    }

    private void record(Execution execution) {
        usage.accumulateAndGet(execution.usage(), ResourceUsage::plus);
        if (execution.outcome() == Outcome.COMPLETED) {
            completed.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }

    private TaskResult toResult(TaskPayload task, Execution execution) {
        return new TaskResult(task.id(), spec.workerId(), execution.outcome(), execution.detail(), execution.usage());
    }

    public void stop() {
        running = false;
    }

    public WorkerSpec spec() {
        return spec;
    }

    public String currentTaskId() {
        return currentTaskId;
    }

    public ResourceUsage usage() {
        return usage.get();
    }

    public int tasksCompleted() {
        return completed.get();
    }

    public int tasksFailed() {
        return failed.get();
    }
}
