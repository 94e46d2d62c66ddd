package tickwork.engine.scheduler;

/**
 * A job schedule expression that cannot be parsed or has no next run.
 */
public class ScheduleException extends RuntimeException {

    public ScheduleException(String message) {
        super(message);
    }

    public ScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
