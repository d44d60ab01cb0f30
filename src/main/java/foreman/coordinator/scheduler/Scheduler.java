package foreman.coordinator.scheduler;

import foreman.coordinator.config.CoordinatorConfig;
import foreman.coordinator.decompose.Decomposer;
import foreman.coordinator.decompose.TaskDescriptions;
import foreman.coordinator.exception.DependencyCycleException;
import foreman.coordinator.exception.InvalidTransitionException;
import foreman.coordinator.exception.TaskRetryExhaustedException;
import foreman.coordinator.exception.UnknownDependencyException;
import foreman.coordinator.model.Outcome;
import foreman.coordinator.model.ResultDisposition;
import foreman.coordinator.model.SchedulerState;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskDescription;
import foreman.coordinator.model.TaskResult;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.queue.ResultChannel;
import foreman.coordinator.queue.WorkQueue;
import foreman.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciliation loop over the task DAG.
 *
 * <pre>
 * IDLE -> DISPATCHING -> AWAITING_RESULTS -> DISPATCHING ...
 *                     \-> DONE | FAILED
 * </pre>
 *
 * The scheduler is the only writer of the task store. Workers reach it through the
 * work queue (claims, lost deliveries) and the result channel (reports).
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final TaskRepository tasks;
    private final WorkQueue workQueue;
    private final ResultChannel results;
    private final Decomposer decomposer;
    private final CoordinatorConfig config;
    private final Clock clock;

    private final Queue<String> goals = new ConcurrentLinkedQueue<>();
    private final AtomicInteger rejectedGoals = new AtomicInteger();

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile String failureReason;
    // first task whose terminal failure took dependents down in this run, and how many
    private String propagatedFrom;
    private int propagatedCount;
    private volatile boolean running = false;
    private Thread thread;

    public Scheduler(TaskRepository tasks,
            WorkQueue workQueue,
            ResultChannel results,
            Decomposer decomposer,
            CoordinatorConfig config) {
        this(tasks, workQueue, results, decomposer, config, Clock.systemUTC());
    }

    public Scheduler(TaskRepository tasks,
            WorkQueue workQueue,
            ResultChannel results,
            Decomposer decomposer,
            CoordinatorConfig config,
            Clock clock) {
        this.tasks = tasks;
        this.workQueue = workQueue;
        this.results = results;
        this.decomposer = decomposer;
        this.config = config;
        this.clock = clock;
    }

    // ==================== Inbound ====================

    /**
     * Queue a goal for decomposition on the next iteration.
     */
    public void submitGoal(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal is required");
        }
        goals.add(goal);
        results.signal();
        log.info("Goal submitted ({} chars), {} waiting", goal.length(), goals.size());
    }

    public SchedulerState state() {
        return state;
    }

    /** Why the last run ended FAILED, or null */
    public String failureReason() {
        return failureReason;
    }

    public int pendingGoals() {
        return goals.size();
    }

    public int rejectedGoals() {
        return rejectedGoals.get();
    }

    // ==================== Loop ====================

    /**
     * One reconciliation pass. Does nothing once the run is terminal.
     *
     * @return state after the pass
     */
    public synchronized SchedulerState runOnce() {
        if (state.isTerminal()) {
            return state;
        }

        try {
            boolean firstPass = state == SchedulerState.IDLE;
            moveTo(SchedulerState.DISPATCHING);
            if (firstPass) {
                recoverOrphans();
            }

            ingestGoals();

            // Reports first: every report drained here has its claim already on the claim list
            List<TaskResult> reports = results.drain();
            recordClaims();
            for (TaskResult report : reports) {
                apply(report);
            }

            recoverLostDeliveries();
            propagateFailures();
            dispatchReady();
            evaluate();

        } catch (SchedulerTransitionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Scheduler run failed", e);
            failureReason = e.getMessage();
            moveTo(SchedulerState.FAILED);
        }
        return state;
    }

    /**
     * Iterate until DONE or FAILED, parking on the result channel between passes.
     */
    public SchedulerState run() throws InterruptedException {
        while (!runOnce().isTerminal()) {
            results.await(config.schedulerPollInterval());
        }
        return state;
    }

    /**
     * Start a new run after a terminal one. Task records are kept.
     */
    public synchronized void reset() {
        if (!state.isTerminal() && state != SchedulerState.IDLE) {
            throw new IllegalStateException("Cannot reset scheduler in state " + state);
        }
        state = SchedulerState.IDLE;
        failureReason = null;
        propagatedFrom = null;
        propagatedCount = 0;
        log.info("Scheduler reset for a new run");
    }

    /**
     * Run in the background: each time a run ends, wait for the next goal and start over.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;
        thread = new Thread(this::serve, "foreman-scheduler");
        thread.setDaemon(true);
        thread.start();
        log.info("Scheduler started");
    }

    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            current = thread;
            thread = null;
        }
        results.signal();
        current.interrupt();
        try {
            current.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped in state {}", state);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void serve() {
        try {
            while (running) {
                SchedulerState finished = run();
                log.info("Run finished: {}", finished);
                while (running && goals.isEmpty()) {
                    results.await(config.schedulerPollInterval());
                }
                if (running) {
                    reset();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Scheduler loop stopped", e);
            running = false;
        }
    }

    // ==================== Steps ====================

    /** Tasks left queued or in progress by an earlier process, unknown to this work queue */
    private void recoverOrphans() {
        for (Task task : tasks.findByStatus(TaskStatus.QUEUED, TaskStatus.IN_PROGRESS)) {
            if (workQueue.isTracked(task.id())) {
                continue;
            }
            if (task.status() == TaskStatus.QUEUED) {
                workQueue.push(task.toPayload());
                log.info("Re-pushed orphaned queued task {}", task.id());
            } else {
                failAndMaybeRetry(task, "orphaned in progress (owner " + task.assignedTo() + " unknown)");
            }
        }
    }

    private void ingestGoals() {
        String goal;
        while ((goal = goals.poll()) != null) {
            try {
                List<TaskDescription> descriptions = decomposer.decompose(goal);
                List<Task> batch = TaskDescriptions.toTasks(descriptions, config.maxAttempts(), Scheduler::newTaskId);
                tasks.upsertAll(batch);
                log.info("Ingested {} tasks from goal", batch.size());
            } catch (IllegalArgumentException | DependencyCycleException | UnknownDependencyException e) {
                rejectedGoals.incrementAndGet();
                log.warn("Rejected goal: {}", e.getMessage());
            }
        }
    }

    private void recordClaims() {
        for (WorkQueue.Delivery claim : workQueue.drainClaims()) {
            Optional<Task> task = tasks.findById(claim.taskId());
            if (task.isPresent() && task.get().status() == TaskStatus.QUEUED) {
                tasks.markInProgress(claim.taskId(), claim.workerId());
                log.debug("Task {} claimed by {}", claim.taskId(), claim.workerId());
            } else {
                log.debug("Ignoring claim of task {} by {}: task is {}", claim.taskId(), claim.workerId(),
                        task.map(t -> t.status().name()).orElse("missing"));
            }
        }
    }

    /**
     * Apply one worker report. Reports for tasks that are no longer in progress under
     * the reporting worker are stale and dropped.
     */
    ResultDisposition apply(TaskResult report) {
        Optional<Task> found = tasks.findById(report.taskId());
        if (found.isEmpty()) {
            log.warn("Result for unknown task {} from {}", report.taskId(), report.workerId());
            return ResultDisposition.NOT_FOUND;
        }
        Task task = found.get();
        if (task.status() != TaskStatus.IN_PROGRESS || !report.workerId().equals(task.assignedTo())) {
            log.debug("Stale result for task {} from {} (task is {} owned by {})",
                    task.id(), report.workerId(), task.status(), task.assignedTo());
            return ResultDisposition.STALE;
        }

        if (report.outcome() == Outcome.COMPLETED) {
            tasks.markCompleted(task.id(), report.detail());
            log.info("Task {} completed by {}", task.id(), report.workerId());
            return ResultDisposition.COMPLETED;
        }
        String reason = report.detail() != null ? report.detail() : "failed without detail";
        return failAndMaybeRetry(task, reason);
    }

    private void recoverLostDeliveries() {
        for (WorkQueue.Delivery lost : workQueue.expire(clock.instant())) {
            Optional<Task> task = tasks.findById(lost.taskId());
            boolean owned = task.isPresent()
                    && task.get().status() == TaskStatus.IN_PROGRESS
                    && lost.workerId().equals(task.get().assignedTo());
            if (!owned) {
                continue;
            }
            failAndMaybeRetry(task.get(), "delivery lost: worker " + lost.workerId() + " did not report");
        }
    }

    /**
     * Record a failed attempt; re-queue while attempts remain, otherwise the failure is final
     * and its reason names the exhausted retries.
     */
    private ResultDisposition failAndMaybeRetry(Task task, String reason) {
        int attemptsAfter = task.attempts() + 1;
        String recorded = attemptsAfter >= task.maxAttempts()
                ? new TaskRetryExhaustedException(task.id(), attemptsAfter, reason).getMessage()
                : reason;

        try {
            Task failed = tasks.markFailed(task.id(), recorded);
            if (failed.canRetry()) {
                Task queued = tasks.transition(task.id(), TaskStatus.QUEUED);
                workQueue.push(queued.toPayload());
                log.info("Task {} failed ({}), retrying: attempt {}/{}",
                        task.id(), reason, failed.attempts() + 1, failed.maxAttempts());
                return ResultDisposition.RETRIED;
            }
            log.warn("Task {} failed permanently: {}", task.id(), recorded);
            return ResultDisposition.FAILED;
        } catch (InvalidTransitionException e) {
            log.error("Could not record failure of task {}", task.id(), e);
            return ResultDisposition.STALE;
        }
    }

    /**
     * Conservative: every pending transitive dependent of a failed task fails too.
     * The run is remembered as failed and ends FAILED once the rest of the graph settles.
     */
    private void propagateFailures() {
        Map<String, String> blocked = DependencyResolver.blocked(tasks.snapshot());
        blocked.forEach((taskId, failedId) -> {
            tasks.markFailed(taskId, "dependency failed: " + failedId);
            log.warn("Task {} failed: dependency {} failed", taskId, failedId);
            if (propagatedFrom == null) {
                propagatedFrom = failedId;
            }
            propagatedCount++;
        });
    }

    private void dispatchReady() {
        List<Task> ready = DependencyResolver.ready(tasks.snapshot());
        for (Task task : ready) {
            Task queued = tasks.transition(task.id(), TaskStatus.QUEUED);
            workQueue.push(queued.toPayload());
        }
        if (!ready.isEmpty()) {
            log.debug("Dispatched {} ready tasks", ready.size());
        }
    }

    private void evaluate() {
        TaskSnapshot snapshot = tasks.snapshot();
        if (goals.isEmpty() && !snapshot.hasActiveTasks()) {
            if (propagatedCount > 0) {
                failureReason = "task " + propagatedFrom + " failed terminally; "
                        + propagatedCount + " dependent task(s) can never run";
                log.error("Run failed: {}", failureReason);
                moveTo(SchedulerState.FAILED);
                return;
            }
            moveTo(SchedulerState.DONE);
            log.info("All tasks settled: {}", snapshot.countByStatus());
            return;
        }
        boolean nothingMoving = snapshot.count(TaskStatus.QUEUED) == 0
                && snapshot.count(TaskStatus.IN_PROGRESS) == 0;
        if (goals.isEmpty() && nothingMoving && snapshot.count(TaskStatus.PENDING) > 0) {
            failureReason = snapshot.count(TaskStatus.PENDING) + " pending task(s) can never become ready";
            log.error("Scheduler stalled: {}", failureReason);
            moveTo(SchedulerState.FAILED);
            return;
        }
        moveTo(SchedulerState.AWAITING_RESULTS);
    }

    private void moveTo(SchedulerState next) {
        if (!state.canTransitionTo(next)) {
            throw new SchedulerTransitionException(state, next);
        }
        SchedulerState previous = state;
        state = next;
        if (next.isTerminal()) {
            log.info("Scheduler {} -> {}", previous, next);
        } else {
            log.debug("Scheduler {} -> {}", previous, next);
        }
    }

    /** A broken state machine; never absorbed into a FAILED run */
    static final class SchedulerTransitionException extends IllegalStateException {
        SchedulerTransitionException(SchedulerState from, SchedulerState to) {
            super("Illegal scheduler transition " + from + " -> " + to);
        }
    }

    private static String newTaskId() {
        return "task-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
