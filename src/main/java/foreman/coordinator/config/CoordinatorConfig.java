package foreman.coordinator.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    /** Where task records live */
    public enum StoreType {
        MEMORY, JDBC
    }

    // Store settings
    private StoreType storeType = StoreType.MEMORY;
    private String databaseUrl = "jdbc:h2:file:./data/foreman;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Queue settings
    private Duration queueTimeout = Duration.ofSeconds(5);
    private Duration visibilityTimeout = Duration.ofMinutes(10);

    // Task settings
    private int maxAttempts = 3;
    private Duration schedulerPollInterval = Duration.ofMillis(500);

    // Pool settings
    private int maxWorkers = 8;
    private int minWorkers = 1;
    private int targetTasksPerWorker = 2;
    private Duration autoScaleInterval = Duration.ofSeconds(5);
    private Duration heartbeatInterval = Duration.ofSeconds(2);
    private Duration heartbeatTimeout = Duration.ofSeconds(10);
    private Duration healthCheckInterval = Duration.ofSeconds(2);
    private double costBudgetUsd = 0.0; // 0 = unlimited
    private List<String> workerModels = List.of(
            "minimax/minimax-m2",
            "deepseek/deepseek-v3.1",
            "moonshotai/kimi-k2-thinking",
            "qwen/qwen3-32b:thinking");

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return fromLookup(System::getenv);
    }

    /**
     * Build a config from an environment-like lookup. Unset or blank keys keep defaults.
     */
    static CoordinatorConfig fromLookup(Function<String, String> env) {
        CoordinatorConfig config = new CoordinatorConfig();

        String store = env.apply("FOREMAN_STORE");
        if (isSet(store)) {
            config.storeType = StoreType.valueOf(store.trim().toUpperCase(Locale.ROOT));
        }

        String dbUrl = env.apply("FOREMAN_DB_URL");
        if (isSet(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String port = env.apply("FOREMAN_PORT");
        if (isSet(port)) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String maxAttempts = env.apply("FOREMAN_MAX_ATTEMPTS");
        if (isSet(maxAttempts)) {
            config.maxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String maxWorkers = env.apply("FOREMAN_MAX_WORKERS");
        if (isSet(maxWorkers)) {
            config.maxWorkers = Integer.parseInt(maxWorkers.trim());
        }

        String minWorkers = env.apply("FOREMAN_MIN_WORKERS");
        if (isSet(minWorkers)) {
            config.minWorkers = Integer.parseInt(minWorkers.trim());
        }

        String ratio = env.apply("FOREMAN_TASKS_PER_WORKER");
        if (isSet(ratio)) {
            config.targetTasksPerWorker = Integer.parseInt(ratio.trim());
        }

        String queueTimeout = env.apply("FOREMAN_QUEUE_TIMEOUT_MS");
        if (isSet(queueTimeout)) {
            config.queueTimeout = Duration.ofMillis(Long.parseLong(queueTimeout.trim()));
        }

        String visibility = env.apply("FOREMAN_VISIBILITY_TIMEOUT_MS");
        if (isSet(visibility)) {
            config.visibilityTimeout = Duration.ofMillis(Long.parseLong(visibility.trim()));
        }

        String autoScale = env.apply("FOREMAN_AUTOSCALE_INTERVAL_MS");
        if (isSet(autoScale)) {
            config.autoScaleInterval = Duration.ofMillis(Long.parseLong(autoScale.trim()));
        }

        String heartbeatTimeout = env.apply("FOREMAN_HEARTBEAT_TIMEOUT_MS");
        if (isSet(heartbeatTimeout)) {
            config.heartbeatTimeout = Duration.ofMillis(Long.parseLong(heartbeatTimeout.trim()));
        }

        String budget = env.apply("FOREMAN_COST_BUDGET_USD");
        if (isSet(budget)) {
            config.costBudgetUsd = Double.parseDouble(budget.trim());
        }

        String models = env.apply("FOREMAN_WORKER_MODELS");
        if (isSet(models)) {
            config.workerModels = Arrays.stream(models.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }

        return config.validate();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * @throws IllegalArgumentException if the pool bounds or timeouts make no sense
     */
    public CoordinatorConfig validate() {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1");
        }
        if (minWorkers < 0 || minWorkers > maxWorkers) {
            throw new IllegalArgumentException("minWorkers must be within 0.." + maxWorkers);
        }
        if (targetTasksPerWorker < 1) {
            throw new IllegalArgumentException("targetTasksPerWorker must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (workerModels.isEmpty()) {
            throw new IllegalArgumentException("at least one worker model is required");
        }
        return this;
    }

    // Getters
    public StoreType storeType() {
        return storeType;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration queueTimeout() {
        return queueTimeout;
    }

    public Duration visibilityTimeout() {
        return visibilityTimeout;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration schedulerPollInterval() {
        return schedulerPollInterval;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int minWorkers() {
        return minWorkers;
    }

    public int targetTasksPerWorker() {
        return targetTasksPerWorker;
    }

    public Duration autoScaleInterval() {
        return autoScaleInterval;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration heartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public double costBudgetUsd() {
        return costBudgetUsd;
    }

    public boolean hasCostBudget() {
        return costBudgetUsd > 0;
    }

    public List<String> workerModels() {
        return workerModels;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withStoreType(StoreType storeType) {
        this.storeType = storeType;
        return this;
    }

    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withQueueTimeout(Duration timeout) {
        this.queueTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withVisibilityTimeout(Duration timeout) {
        this.visibilityTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public CoordinatorConfig withSchedulerPollInterval(Duration interval) {
        this.schedulerPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    public CoordinatorConfig withMinWorkers(int minWorkers) {
        this.minWorkers = minWorkers;
        return this;
    }

    public CoordinatorConfig withTargetTasksPerWorker(int ratio) {
        this.targetTasksPerWorker = ratio;
        return this;
    }

    public CoordinatorConfig withAutoScaleInterval(Duration interval) {
        this.autoScaleInterval = interval;
        return this;
    }

    public CoordinatorConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public CoordinatorConfig withHeartbeatTimeout(Duration timeout) {
        this.heartbeatTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public CoordinatorConfig withCostBudgetUsd(double budget) {
        this.costBudgetUsd = budget;
        return this;
    }

    public CoordinatorConfig withWorkerModels(List<String> models) {
        this.workerModels = List.copyOf(models);
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "store=" + storeType +
                ", serverPort=" + serverPort +
                ", workers=" + minWorkers + ".." + maxWorkers +
                ", tasksPerWorker=" + targetTasksPerWorker +
                ", maxAttempts=" + maxAttempts +
                ", visibilityTimeout=" + visibilityTimeout +
                ", costBudgetUsd=" + costBudgetUsd +
                '}';
    }
}
