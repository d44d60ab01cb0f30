package foreman.coordinator.exception;

/**
 * Spawn rejected: the concurrency ceiling or the cost budget is reached.
 */
public class ScaleLimitExceededException extends CoordinatorException {

    public ScaleLimitExceededException(String message) {
        super(message);
    }
}
