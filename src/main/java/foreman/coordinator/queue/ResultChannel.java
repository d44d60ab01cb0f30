package foreman.coordinator.queue;

import foreman.coordinator.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded multi-producer, single-consumer channel of worker reports.
 * The consumer parks in {@link #await} until a report arrives or someone {@linkplain #signal signals}.
 */
public final class ResultChannel {

    private static final Logger log = LoggerFactory.getLogger(ResultChannel.class);

    private final LinkedBlockingQueue<TaskResult> results = new LinkedBlockingQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private boolean signalled;

    public void publish(TaskResult result) {
        results.add(result);
        log.debug("Result for task {} from {}: {}", result.taskId(), result.workerId(), result.outcome());
        signal();
    }

    /** Wake the consumer without a report (new goal submitted, shutdown). */
    public void signal() {
        lock.lock();
        try {
            signalled = true;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Every report currently available, in arrival order */
    public List<TaskResult> drain() {
        List<TaskResult> drained = new ArrayList<>();
        results.drainTo(drained);
        return drained;
    }

    /**
     * Park until a report is available, a signal arrives or the timeout elapses.
     *
     * @return true if woken by a report or a signal
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long remaining = TimeUnit.MILLISECONDS.toNanos(timeout.toMillis());
        lock.lock();
        try {
            while (results.isEmpty() && !signalled) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = wakeUp.awaitNanos(remaining);
            }
            signalled = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return results.size();
    }
}
