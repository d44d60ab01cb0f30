package foreman.coordinator.worker;

import java.util.Optional;

/**
 * Launch mechanics for workers: a thread, a process, a container.
 * The pool manager only talks to workers through this interface.
 */
public interface WorkerRuntime extends AutoCloseable {

    /**
     * Start one worker.
     *
     * @return handle used for every later call about this worker
     */
    WorkerHandle start(WorkerSpec spec);

    /**
     * Ask the worker to stop. Idempotent; unknown handles are ignored.
     */
    void terminate(WorkerHandle handle);

    /**
     * Latest heartbeat, or empty if the worker never sent one.
     */
    Optional<Heartbeat> heartbeat(WorkerHandle handle);

    /** Terminate everything still running. */
    @Override
    void close();
}
