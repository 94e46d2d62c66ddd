package tickwork.engine.tasks;

import tickwork.engine.config.EngineConfig;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.repository.ExecutionResultRepository;

import java.time.Clock;

/**
 * Registers the tasks every engine process ships with, and declares the
 * standard queue names of the reference deployment.
 */
public final class BuiltinTasks {

    private BuiltinTasks() {
    }

    public static TaskRegistry register(TaskRegistry registry, ExecutionResultRepository results,
            EngineConfig config, Clock clock) {
        registry.declareQueues(QueueBinding.parse(EngineConfig.DEFAULT_QUEUES).names());
        registry.register(EchoTask.TYPE, EchoTask.QUEUE, new EchoTask());
        registry.register(PurgeExecutionResultsTask.TYPE, PurgeExecutionResultsTask.QUEUE,
                new PurgeExecutionResultsTask(results, config.resultRetention(), clock));
        return registry;
    }
}
