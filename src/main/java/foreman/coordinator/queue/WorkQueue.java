package foreman.coordinator.queue;

import foreman.coordinator.model.TaskPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * FIFO channel of ready task payloads, written by the scheduler and read by workers.
 *
 * <p>Delivery is at-least-once. Every {@link #take} registers an in-flight delivery
 * that stays visible to the scheduler until the worker {@linkplain #acknowledge acknowledges}
 * it. A delivery whose visibility window elapses, or whose worker is
 * {@linkplain #release released}, comes back exactly once from {@link #expire}.
 */
public final class WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    /** One payload handed to one worker, visible until {@code deadline} */
    public record Delivery(TaskPayload payload, String workerId, Instant takenAt, Instant deadline) {

        public String taskId() {
            return payload.id();
        }
    }

    private final LinkedBlockingQueue<TaskPayload> items = new LinkedBlockingQueue<>();
    private final Map<String, Delivery> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<Delivery> claims = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Delivery> lost = new ConcurrentLinkedQueue<>();
    private final Duration visibilityTimeout;
    private final Clock clock;

    public WorkQueue(Duration visibilityTimeout) {
        this(visibilityTimeout, Clock.systemUTC());
    }

    public WorkQueue(Duration visibilityTimeout, Clock clock) {
        this.visibilityTimeout = visibilityTimeout;
        this.clock = clock;
    }

    /**
     * Append a payload. Order of pushes is the order of takes.
     */
    public void push(TaskPayload payload) {
        items.add(payload);
        log.debug("Enqueued task {} (depth {})", payload.id(), items.size());
    }

    /**
     * Wait up to {@code timeout} for the next payload.
     *
     * @return the delivery, or empty when nothing arrived in time ("no work")
     * @throws InterruptedException if the worker is interrupted while waiting
     */
    public Optional<Delivery> take(String workerId, Duration timeout) throws InterruptedException {
        TaskPayload payload = items.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (payload == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Delivery delivery = new Delivery(payload, workerId, now, now.plus(visibilityTimeout));
        inFlight.put(payload.id(), delivery);
        claims.add(delivery);
        log.debug("Worker {} took task {}", workerId, payload.id());
        return Optional.of(delivery);
    }

    /**
     * The worker has reported on the task; the delivery is durably consumed.
     *
     * @return false if the delivery was already expired, released or held by someone else
     */
    public boolean acknowledge(String taskId, String workerId) {
        Delivery current = inFlight.get(taskId);
        if (current == null || !current.workerId().equals(workerId)) {
            return false;
        }
        return inFlight.remove(taskId, current);
    }

    /**
     * Every take since the previous call, in take order.
     */
    public List<Delivery> drainClaims() {
        return drain(claims);
    }

    /**
     * Remove and return the deliveries that are lost: released by {@link #release},
     * or unacknowledged past their visibility deadline.
     */
    public List<Delivery> expire(Instant now) {
        List<Delivery> result = drain(lost);
        for (Delivery delivery : List.copyOf(inFlight.values())) {
            if (now.isAfter(delivery.deadline()) && inFlight.remove(delivery.taskId(), delivery)) {
                log.debug("Delivery of task {} to {} expired", delivery.taskId(), delivery.workerId());
                result.add(delivery);
            }
        }
        return result;
    }

    /**
     * Treat every delivery held by the worker as lost.
     *
     * @return ids of the released tasks
     */
    public List<String> release(String workerId) {
        List<String> released = new ArrayList<>();
        for (Delivery delivery : List.copyOf(inFlight.values())) {
            if (delivery.workerId().equals(workerId) && inFlight.remove(delivery.taskId(), delivery)) {
                lost.add(delivery);
                released.add(delivery.taskId());
            }
        }
        if (!released.isEmpty()) {
            log.info("Released {} task(s) held by worker {}: {}", released.size(), workerId, released);
        }
        return released;
    }

    /** Task the worker currently holds, if any */
    public Optional<String> heldBy(String workerId) {
        return inFlight.values().stream()
                .filter(d -> d.workerId().equals(workerId))
                .map(Delivery::taskId)
                .findFirst();
    }

    /** Waiting, in flight, or about to be reported lost */
    public boolean isTracked(String taskId) {
        return inFlight.containsKey(taskId)
                || items.stream().anyMatch(p -> p.id().equals(taskId))
                || lost.stream().anyMatch(d -> d.taskId().equals(taskId));
    }

    /** Number of payloads waiting to be taken */
    public int depth() {
        return items.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static List<Delivery> drain(ConcurrentLinkedQueue<Delivery> source) {
        List<Delivery> result = new ArrayList<>();
        Delivery next;
        while ((next = source.poll()) != null) {
            result.add(next);
        }
        return result;
    }
}
