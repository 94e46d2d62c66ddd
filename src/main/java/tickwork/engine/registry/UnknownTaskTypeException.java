package tickwork.engine.registry;

/**
 * Thrown when a job or message names a task type nobody registered.
 */
public class UnknownTaskTypeException extends IllegalArgumentException {

    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("Unknown task type: " + taskType);
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
