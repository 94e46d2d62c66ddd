package tickwork.engine.store;

/**
 * The relational store could not be reached or rejected an operation.
 * Treated as transient by the scheduler and worker loops.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
