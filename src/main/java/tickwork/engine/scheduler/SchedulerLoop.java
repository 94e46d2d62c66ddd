package tickwork.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.BrokerException;
import tickwork.engine.broker.LockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.store.StoreException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link JobScheduler#tick()} at a fixed interval on a single thread.
 *
 * <p>With the leader lease enabled, each run first takes or renews the
 * {@value #LEADER_KEY} lock; instances that do not hold it stay on standby and
 * skip the tick. The lease lives three tick intervals, so a standby takes over
 * within that window after the leader stops renewing.
 */
public class SchedulerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    public static final String LEADER_KEY = "scheduler:leader";

    private final ScheduledExecutorService executor;
    private final JobScheduler scheduler;
    private final LockManager locks;
    private final EngineConfig config;
    private final String instanceId;

    private volatile boolean running = false;
    private volatile boolean leader = false;
    private volatile TickReport lastReport;

    public SchedulerLoop(JobScheduler scheduler, LockManager locks, EngineConfig config, String instanceId) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tickwork-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = scheduler;
        this.locks = locks;
        this.config = config;
        this.instanceId = instanceId;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler loop already running");
            return;
        }

        running = true;
        long intervalMs = config.tickInterval().toMillis();
        executor.scheduleWithFixedDelay(this::runSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler {} ticking every {}ms (leader lease {})",
                instanceId, intervalMs, config.leaderLease() ? "on" : "off");
    }

    /**
     * Take or renew the lease, then tick.
     *
     * @return empty when this instance is on standby
     */
    public Optional<TickReport> runOnce() {
        if (config.leaderLease() && !holdLease()) {
            return Optional.empty();
        }
        TickReport report = scheduler.tick();
        lastReport = report;
        return Optional.of(report);
    }

    private boolean holdLease() {
        boolean acquired = locks.tryAcquire(LEADER_KEY, instanceId, leaseTtl());
        if (acquired != leader) {
            if (acquired) {
                log.info("Scheduler {} is now the leader", instanceId);
            } else {
                log.info("Scheduler {} lost the lease, standing by", instanceId);
            }
        }
        leader = acquired;
        return acquired;
    }

    Duration leaseTtl() {
        return config.tickInterval().multipliedBy(3);
    }

    private void runSafely() {
        try {
            runOnce();
        } catch (BrokerException | StoreException e) {
            log.warn("Tick aborted, retrying next tick: {}", e.getMessage());
            log.debug("Tick failure", e);
        } catch (Exception e) {
            log.error("Tick error", e);
        }
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler loop forcefully stopped");
            } else {
                log.info("Scheduler loop stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (leader) {
            try {
                locks.release(LEADER_KEY, instanceId);
            } catch (BrokerException e) {
                log.warn("Failed to release scheduler lease, it will expire: {}", e.getMessage());
            }
            leader = false;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isLeader() {
        return !config.leaderLease() || leader;
    }

    public String instanceId() {
        return instanceId;
    }

    public TickReport lastReport() {
        return lastReport;
    }
}
