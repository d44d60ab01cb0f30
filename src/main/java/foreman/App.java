package foreman;

import foreman.coordinator.config.CoordinatorConfig;
import foreman.coordinator.config.Dependencies;
import foreman.coordinator.server.CoordinatorServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: wires the coordinator from the environment, starts its loops and
 * serves the control API until the JVM is asked to stop.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorServer server = new CoordinatorServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "foreman-shutdown"));

        try {
            deps.start();
            server.start(config.serverHost(), config.serverPort());
        } catch (RuntimeException e) {
            log.error("Failed to start coordinator", e);
            System.exit(1);
        }

        for (String goal : args) {
            deps.scheduler().submitGoal(goal);
        }

        stopped.await();
    }
}
