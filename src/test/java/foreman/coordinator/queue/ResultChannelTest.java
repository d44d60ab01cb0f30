package foreman.coordinator.queue;

import foreman.coordinator.model.Outcome;
import foreman.coordinator.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultChannelTest {

    private final ResultChannel channel = new ResultChannel();

    @Test
    void drainReturnsReportsInArrivalOrder() {
        channel.publish(TaskResult.completed("a", "worker-1", "ok"));
        channel.publish(TaskResult.failed("b", "worker-2", "boom"));

        List<TaskResult> drained = channel.drain();

        assertEquals(List.of("a", "b"), drained.stream().map(TaskResult::taskId).toList());
        assertEquals(Outcome.FAILED, drained.get(1).outcome());
        assertEquals(0, channel.size());
    }

    @Test
    void awaitTimesOutWithoutReports() throws Exception {
        assertFalse(channel.await(Duration.ofMillis(30)));
    }

    @Test
    void awaitReturnsImmediatelyWhenReportWaiting() throws Exception {
        channel.publish(TaskResult.completed("a", "worker-1", "ok"));
        assertTrue(channel.await(Duration.ofSeconds(5)));
    }

    @Test
    void signalWakesWaiterOnce() throws Exception {
        channel.signal();
        assertTrue(channel.await(Duration.ofSeconds(5)));
        assertFalse(channel.await(Duration.ofMillis(20)));
    }

    @Test
    void publishFromAnotherThreadWakesWaiter() throws Exception {
        Thread worker = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            channel.publish(TaskResult.completed("a", "worker-1", "ok"));
        });
        worker.start();

        assertTrue(channel.await(Duration.ofSeconds(5)));
        worker.join();
        assertEquals(1, channel.drain().size());
    }
}
