package tickwork.engine.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.config.QueueBinding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps task-type names to capabilities. Populated at startup, read by the
 * scheduler and workers afterwards.
 *
 * <p>Besides the queues declared by registered tasks, a registry knows a set
 * of standalone queue names, so a deployment can bind queues whose tasks are
 * registered in other processes.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    public static final String DEFAULT_QUEUE = "default";

    private final Map<String, RegisteredTask> tasks = new ConcurrentHashMap<>();
    private final Set<String> standaloneQueues = Collections.synchronizedSet(new LinkedHashSet<>());

    public TaskRegistry() {
        standaloneQueues.add(DEFAULT_QUEUE);
    }

    public TaskRegistry register(RegisteredTask task) {
        RegisteredTask previous = tasks.putIfAbsent(task.type(), task);
        if (previous != null) {
            throw new IllegalArgumentException("Task type already registered: " + task.type());
        }
        log.debug("Registered task {} on queue {}", task.type(), task.queue());
        return this;
    }

    public TaskRegistry register(String type, String queue, TaskCapability capability) {
        return register(RegisteredTask.of(type, queue, capability));
    }

    /** Declare queue names that are valid even without a task registered here. */
    public TaskRegistry declareQueues(Collection<String> queues) {
        for (String queue : queues) {
            standaloneQueues.add(QueueBinding.validateName(queue));
        }
        return this;
    }

    public Optional<RegisteredTask> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(type));
    }

    public RegisteredTask require(String type) {
        return find(type).orElseThrow(() -> new UnknownTaskTypeException(type));
    }

    public boolean contains(String type) {
        return type != null && tasks.containsKey(type);
    }

    public Set<String> types() {
        return Set.copyOf(tasks.keySet());
    }

    /** Every queue name this registry knows about. */
    public Set<String> declaredQueues() {
        Set<String> queues = new LinkedHashSet<>();
        synchronized (standaloneQueues) {
            queues.addAll(standaloneQueues);
        }
        tasks.values().forEach(t -> queues.add(t.queue()));
        return queues;
    }

    public boolean isDeclaredQueue(String queue) {
        return declaredQueues().contains(queue);
    }

    /**
     * Check a worker binding against the registry.
     *
     * @return queues that registered tasks use but this binding does not poll
     * @throws IllegalStateException if the binding names a queue nobody declared
     */
    public List<String> validateBinding(QueueBinding binding) {
        Set<String> declared = declaredQueues();
        List<String> unknown = new ArrayList<>();
        for (String queue : binding) {
            if (!declared.contains(queue)) {
                unknown.add(queue);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("Queue binding names undeclared queues " + unknown
                    + "; declared queues are " + declared);
        }

        List<String> unpolled = new ArrayList<>();
        for (RegisteredTask task : tasks.values()) {
            if (!binding.contains(task.queue()) && !unpolled.contains(task.queue())) {
                unpolled.add(task.queue());
            }
        }
        return unpolled;
    }

    /**
     * Check that every task times out before its delivery becomes visible again.
     *
     * @throws IllegalStateException naming the tasks whose timeout is not below {@code visibilityTimeout}
     */
    public void validateTimeouts(Duration defaultTimeout, Duration visibilityTimeout) {
        List<String> tooLong = new ArrayList<>();
        for (RegisteredTask task : tasks.values()) {
            if (task.timeoutOr(defaultTimeout).compareTo(visibilityTimeout) >= 0) {
                tooLong.add(task.type() + "=" + task.timeoutOr(defaultTimeout));
            }
        }
        if (!tooLong.isEmpty()) {
            Collections.sort(tooLong);
            throw new IllegalStateException("Task timeouts " + tooLong + " must be below the visibility timeout "
                    + visibilityTimeout);
        }
    }

    public int size() {
        return tasks.size();
    }
}
