package tickwork.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.broker.Broker;
import tickwork.engine.broker.BrokerException;
import tickwork.engine.broker.LockManager;
import tickwork.engine.config.EngineConfig;
import tickwork.engine.model.Job;
import tickwork.engine.model.TaskMessage;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.repository.JobRepository;
import tickwork.engine.store.StoreException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates due jobs and turns each into one queued message.
 *
 * <p>Per due job, in ascending next-run order:
 * <ol>
 * <li>parse the schedule and compute the next run; a malformed schedule, or one whose
 * next run is out of range, disables the job</li>
 * <li>resolve the task type; an unknown one disables the job</li>
 * <li>take the job lock, owned by the new message id; skip the job if it is held</li>
 * <li>advance next-run with a compare-and-set on the old value</li>
 * <li>enqueue the message; on failure the advance and the lock are undone</li>
 * </ol>
 * The lock stays with the message until its terminal result is written.
 *
 * <p>Broker or store failures abort the tick; anything else only skips the job.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    static final int DUE_BATCH_SIZE = 500;

    private final JobRepository jobs;
    private final Broker broker;
    private final LockManager locks;
    private final TaskRegistry registry;
    private final EngineConfig config;
    private final Clock clock;

    public JobScheduler(JobRepository jobs, Broker broker, LockManager locks, TaskRegistry registry,
            EngineConfig config, Clock clock) {
        this.jobs = jobs;
        this.broker = broker;
        this.locks = locks;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run one evaluation cycle.
     *
     * @throws BrokerException if the broker is unreachable
     * @throws StoreException  if the store is unreachable
     */
    public TickReport tick() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        List<Job> due = jobs.findDue(now, DUE_BATCH_SIZE);
        if (due.isEmpty()) {
            return TickReport.idle(now);
        }

        TickReport.Builder report = new TickReport.Builder(now).due(due.size());
        for (Job job : due) {
            try {
                process(job, now, report);
            } catch (BrokerException | StoreException e) {
                throw e;
            } catch (RuntimeException e) {
                report.errored();
                log.error("Failed to schedule job {}", job.id(), e);
            }
        }

        TickReport result = report.build();
        log.info("Tick {}: {} due, {} enqueued, {} locked, {} raced, {} disabled, {} errored",
                now, result.due(), result.enqueued(), result.skippedLocked(), result.skippedRaced(),
                result.disabled(), result.errored());
        return result;
    }

    private void process(Job job, Instant now, TickReport.Builder report) {
        Instant nextRun;
        try {
            nextRun = Schedules.parse(job.schedule()).nextRun(job.nextRun(), now).truncatedTo(ChronoUnit.MILLIS);
        } catch (ScheduleException e) {
            disable(job, "invalid schedule '" + job.schedule() + "': " + e.getMessage(), report);
            return;
        }

        Optional<RegisteredTask> task = registry.find(job.taskType());
        if (task.isEmpty()) {
            disable(job, "unknown task type: " + job.taskType(), report);
            return;
        }

        String queue = job.queue() != null ? job.queue() : task.get().queue();
        TaskMessage message = TaskMessage.builder()
                .id(TaskMessage.newId())
                .queue(queue)
                .jobId(job.id())
                .taskType(job.taskType())
                .params(job.params())
                .enqueuedAt(now)
                .maxAttempts(task.get().maxAttemptsOr(config.maxAttempts()))
                .build();

        String lockKey = job.lockKey();
        if (!locks.tryAcquire(lockKey, message.id(), config.lockTtl())) {
            report.skippedLocked();
            log.debug("Job {} skipped, lock {} is held", job.id(), lockKey);
            return;
        }

        if (!jobs.advanceNextRun(job.id(), job.nextRun(), nextRun, now)) {
            locks.release(lockKey, message.id());
            report.skippedRaced();
            log.debug("Job {} was advanced by another scheduler", job.id());
            return;
        }

        try {
            broker.enqueue(message);
        } catch (BrokerException e) {
            undoAdvance(job, nextRun, message.id(), e);
            throw e;
        }

        report.enqueued();
        log.debug("Job {} enqueued as {} on {}, next run {}", job.id(), message.id(), queue, nextRun);
    }

    private void undoAdvance(Job job, Instant nextRun, String lockOwner, BrokerException cause) {
        try {
            jobs.advanceNextRun(job.id(), nextRun, job.nextRun(), job.lastRun());
        } catch (StoreException e) {
            cause.addSuppressed(e);
        }
        // the lock expires on its own if the broker is gone
        try {
            locks.release(job.lockKey(), lockOwner);
        } catch (BrokerException e) {
            cause.addSuppressed(e);
        }
    }

    private void disable(Job job, String reason, TickReport.Builder report) {
        jobs.disable(job.id(), reason);
        report.disabled();
        log.warn("Job {} disabled: {}", job.id(), reason);
    }
}
