package tickwork.engine.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.Broker;
import tickwork.engine.broker.BrokerException;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.model.ExecutionResult;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.TaskRegistry;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool of execution slots bound to an ordered set of queues.
 *
 * <p>A single poller thread takes a free slot before each dequeue, so a busy
 * pool stops pulling messages until a task finishes. Queues are polled in
 * binding order. When all are empty the poller waits the poll interval.
 *
 * <p>Shutdown stops dequeuing, lets in-flight tasks finish within the grace
 * period, then interrupts them. Messages they held are redelivered by the
 * broker after the visibility timeout.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final Broker broker;
    private final TaskRegistry registry;
    private final EngineConfig config;
    private final QueueBinding queues;
    private final String workerId;
    private final TaskRunner runner;
    private final MessageReaper reaper;

    private final Semaphore slots;
    private final ExecutorService slotExecutor;
    private final ExecutorService taskExecutor;
    private final ScheduledExecutorService reaperExecutor;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running = false;
    private volatile Thread poller;

    public WorkerPool(Broker broker, TaskRegistry registry, ResultWriter writer, EngineConfig config,
            Clock clock, String workerId) {
        this.broker = broker;
        this.registry = registry;
        this.config = config;
        this.queues = config.queues();
        this.workerId = workerId;
        this.slots = new Semaphore(config.workersCount());
        this.slotExecutor = Executors.newFixedThreadPool(config.workersCount(), daemonFactory("tickwork-worker"));
        this.taskExecutor = Executors.newCachedThreadPool(daemonFactory("tickwork-task"));
        this.reaperExecutor = Executors.newSingleThreadScheduledExecutor(daemonFactory("tickwork-reaper"));
        this.runner = new TaskRunner(registry, writer, config, taskExecutor, clock, workerId);
        this.reaper = new MessageReaper(broker, writer, clock, workerId);
    }

    /**
     * Validate the queue binding and start polling.
     *
     * @throws IllegalStateException if the binding names a queue the registry does not know, or a task
     *                               timeout is not below the visibility timeout
     */
    public void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        registry.validateTimeouts(config.taskTimeout(), config.visibilityTimeout());
        List<String> unpolled = registry.validateBinding(queues);
        if (!unpolled.isEmpty()) {
            log.warn("Queues {} have registered tasks but are not bound here; another worker must poll them",
                    unpolled);
        }

        running = true;
        Thread t = new Thread(this::pollLoop, "tickwork-poller");
        t.setDaemon(true);
        poller = t;
        t.start();

        long reaperMs = config.reaperInterval().toMillis();
        reaperExecutor.scheduleWithFixedDelay(reaper, reaperMs, reaperMs, TimeUnit.MILLISECONDS);

        log.info("Worker pool {} started: {} slots on queues [{}]", workerId, config.workersCount(), queues);
    }

    private void pollLoop() {
        while (running) {
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            boolean dispatched = false;
            try {
                if (!running) {
                    break;
                }
                Optional<TaskMessage> message = broker.dequeue(queues.names(), config.visibilityTimeout());
                if (message.isPresent()) {
                    dispatch(message.get());
                    dispatched = true;
                } else {
                    idle();
                }
            } catch (BrokerException e) {
                log.warn("Dequeue failed, retrying in {}: {}", config.pollInterval(), e.getMessage());
                idle();
            } catch (Exception e) {
                log.error("Poller error", e);
                idle();
            } finally {
                if (!dispatched) {
                    slots.release();
                }
            }
        }
        log.debug("Poller stopped");
    }

    private void dispatch(TaskMessage message) {
        slotExecutor.execute(() -> {
            try {
                execute(message);
            } finally {
                slots.release();
            }
        });
    }

    private Optional<ExecutionResult> execute(TaskMessage message) {
        try {
            Optional<ExecutionResult> result = runner.run(message);
            result.ifPresent(r -> {
                processed.incrementAndGet();
                if (!r.isSuccess()) {
                    failed.incrementAndGet();
                }
            });
            return result;
        } catch (Exception e) {
            log.error("Failed to settle message {}, it will be redelivered", message.id(), e);
            return Optional.empty();
        }
    }

    private void idle() {
        if (!running) {
            return;
        }
        try {
            Thread.sleep(config.pollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    /**
     * Dequeue and run one message on the calling thread.
     *
     * @return the recorded result, empty if no message was available or it was abandoned
     */
    public Optional<ExecutionResult> runNext() {
        return broker.dequeue(queues.names(), config.visibilityTimeout()).flatMap(this::execute);
    }

    /** Stop dequeuing, wait for in-flight tasks, then interrupt them. */
    public void shutdown() {
        if (!running) {
            shutdownExecutors();
            return;
        }

        running = false;
        Thread t = poller;
        if (t != null) {
            t.interrupt();
            try {
                t.join(config.shutdownGrace().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        reaperExecutor.shutdownNow();
        slotExecutor.shutdown();
        try {
            if (slotExecutor.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Worker pool {} stopped gracefully", workerId);
            } else {
                List<Runnable> pending = slotExecutor.shutdownNow();
                taskExecutor.shutdownNow();
                log.warn("Worker pool {} forcefully stopped, {} in flight abandoned to redelivery",
                        workerId, inFlight() + pending.size());
            }
        } catch (InterruptedException e) {
            slotExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        taskExecutor.shutdownNow();
    }

    private void shutdownExecutors() {
        reaperExecutor.shutdownNow();
        slotExecutor.shutdownNow();
        taskExecutor.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return running;
    }

    public int inFlight() {
        return config.workersCount() - slots.availablePermits();
    }

    /** Task threads still executing, including timed-out tasks that ignored interruption. */
    public int runningTasks() {
        return runner.runningTasks();
    }

    public long processed() {
        return processed.get();
    }

    public long failed() {
        return failed.get();
    }

    public QueueBinding queues() {
        return queues;
    }

    public String workerId() {
        return workerId;
    }

    public MessageReaper reaper() {
        return reaper;
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
