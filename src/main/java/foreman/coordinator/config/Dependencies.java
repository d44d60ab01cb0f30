package foreman.coordinator.config;

import foreman.coordinator.api.v1.GoalController;
import foreman.coordinator.api.v1.HealthController;
import foreman.coordinator.api.v1.TaskController;
import foreman.coordinator.api.v1.WorkerController;
import foreman.coordinator.decompose.Decomposer;
import foreman.coordinator.decompose.GoalDecomposer;
import foreman.coordinator.pool.AutoScaler;
import foreman.coordinator.pool.PoolMaintenance;
import foreman.coordinator.pool.WorkerPool;
import foreman.coordinator.queue.ResultChannel;
import foreman.coordinator.queue.WorkQueue;
import foreman.coordinator.repository.TaskRepository;
import foreman.coordinator.scheduler.Scheduler;
import foreman.coordinator.server.RouterHandler;
import foreman.coordinator.store.Database;
import foreman.coordinator.store.InMemoryTaskRepository;
import foreman.coordinator.store.JdbcTaskRepository;
import foreman.coordinator.worker.SimulatedTaskExecutor;
import foreman.coordinator.worker.TaskExecutor;
import foreman.coordinator.worker.ThreadWorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all coordinator components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.start(); // scheduler loop, health checks, auto-scaling
 * deps.scheduler().submitGoal("...");
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private static final int SIMULATED_DELAY_MIN_MS = 200;
    private static final int SIMULATED_DELAY_MAX_MS = 1500;
    private static final double SIMULATED_FAIL_RATE = 0.1;

    private final CoordinatorConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final WorkQueue workQueue;
    private final ResultChannel resultChannel;
    private final ThreadWorkerRuntime workerRuntime;
    private final WorkerPool workerPool;
    private final AutoScaler autoScaler;
    private final PoolMaintenance poolMaintenance;
    private final Scheduler scheduler;

    // Controllers
    private final HealthController healthController;
    private final WorkerController workerController;
    private final TaskController taskController;
    private final GoalController goalController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, TaskExecutor executor, Decomposer decomposer) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Storage
        if (config.storeType() == CoordinatorConfig.StoreType.JDBC) {
            this.database = new Database(config);
            this.taskRepository = new JdbcTaskRepository(database);
        } else {
            this.database = null;
            this.taskRepository = new InMemoryTaskRepository();
        }

        // Channels between scheduler and workers
        this.workQueue = new WorkQueue(config.visibilityTimeout());
        this.resultChannel = new ResultChannel();

        // Workers
        this.workerRuntime = new ThreadWorkerRuntime(workQueue, resultChannel, executor,
                config.queueTimeout(), config.heartbeatInterval());
        this.workerPool = new WorkerPool(config, workerRuntime, workQueue);
        this.autoScaler = new AutoScaler(workerPool, config.targetTasksPerWorker());
        this.poolMaintenance = new PoolMaintenance(workerPool, autoScaler, config);

        // Scheduler
        this.scheduler = new Scheduler(taskRepository, workQueue, resultChannel, decomposer, config);

        // Controllers
        this.healthController = new HealthController(scheduler, taskRepository, workerPool, database);
        this.workerController = new WorkerController(workerPool);
        this.taskController = new TaskController(taskRepository);
        this.goalController = new GoalController(scheduler);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and simulated workers.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config, new SimulatedTaskExecutor(
                SIMULATED_DELAY_MIN_MS, SIMULATED_DELAY_MAX_MS, SIMULATED_FAIL_RATE));
    }

    public static Dependencies create(CoordinatorConfig config, TaskExecutor executor) {
        return new Dependencies(config, executor, new GoalDecomposer());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    /** Null unless the JDBC store is configured */
    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public WorkQueue workQueue() {
        return workQueue;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public AutoScaler autoScaler() {
        return autoScaler;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get the router handler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(workerController)
                    .registerController(taskController)
                    .registerController(goalController);
        }
        return routerHandler;
    }

    /**
     * Start the background loops: scheduler, health checks and auto-scaling.
     */
    public void start() {
        scheduler.start();
        poolMaintenance.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        poolMaintenance.close();
        scheduler.close();
        workerPool.close();
        workerRuntime.close();
        if (database != null) {
            database.close();
        }
        log.info("Dependencies closed");
    }
}
