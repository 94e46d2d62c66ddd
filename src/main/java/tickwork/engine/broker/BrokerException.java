package tickwork.engine.broker;

/**
 * The broker could not be reached or rejected an operation.
 * Recoverable: scheduler and worker loops retry on their next cycle.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrokerException(String message) {
        super(message);
    }
}
