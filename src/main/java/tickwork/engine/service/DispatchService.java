package tickwork.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.Broker;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.util.Json;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Ad-hoc enqueueing of tasks outside any job schedule. Such messages carry no
 * job id and take no job lock.
 */
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final Broker broker;
    private final TaskRegistry registry;
    private final EngineConfig config;
    private final Clock clock;

    public DispatchService(Broker broker, TaskRegistry registry, EngineConfig config, Clock clock) {
        this.broker = broker;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    public TaskMessage submit(String taskType, String params) {
        return submit(taskType, params, null);
    }

    /**
     * @param queue null to use the task's declared queue
     * @throws IllegalArgumentException for unknown task types, invalid params or undeclared queues
     */
    public TaskMessage submit(String taskType, String params, String queue) {
        RegisteredTask task = registry.require(taskType);
        String targetQueue = queue == null || queue.isBlank() ? task.queue() : QueueBinding.validateName(queue.trim());
        if (!registry.isDeclaredQueue(targetQueue)) {
            throw new IllegalArgumentException("Queue " + targetQueue + " is not declared");
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        TaskMessage message = TaskMessage.builder()
                .id(TaskMessage.newId())
                .queue(targetQueue)
                .taskType(taskType)
                .params(Json.normalize(params))
                .enqueuedAt(now)
                .visibleAt(now)
                .maxAttempts(task.maxAttemptsOr(config.maxAttempts()))
                .build();

        broker.enqueue(message);
        log.info("Submitted {} ({}) to {}", message.id(), taskType, targetQueue);
        return message;
    }
}
