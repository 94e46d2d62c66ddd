package tickwork.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.model.Job;
import tickwork.engine.registry.RegisteredTask;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.repository.JobRepository;
import tickwork.engine.scheduler.Schedule;
import tickwork.engine.scheduler.ScheduleException;
import tickwork.engine.scheduler.Schedules;
import tickwork.engine.util.Json;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Business logic for job definitions. Inputs are validated here so the
 * scheduler only meets jobs that parse; invalid input is rejected with
 * {@link IllegalArgumentException}.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final TaskRegistry registry;
    private final Clock clock;

    public JobService(JobRepository jobRepository, TaskRegistry registry, Clock clock) {
        this.jobRepository = jobRepository;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Create an enabled job.
     *
     * @param queue    null to use the task's declared queue
     * @param firstRun null to start at the schedule's first run
     */
    public Job createJob(String name, String taskType, String schedule, String queue, String params,
            Instant firstRun) {
        RegisteredTask task = requireTask(taskType);
        Schedule parsed = parseSchedule(schedule);
        String targetQueue = resolveQueue(queue, task);
        Instant now = now();

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .name(name)
                .taskType(taskType)
                .schedule(schedule.trim())
                .queue(targetQueue)
                .params(normalizeParams(params))
                .enabled(true)
                .nextRun(firstRun != null ? firstRun : parsed.initialRun(now))
                .createdAt(now)
                .build();

        jobRepository.save(job);
        log.info("Created job {} ({}) on {} with schedule {}", job.id(), taskType, targetQueue, parsed);
        return jobRepository.findById(job.id()).orElse(job);
    }

    /**
     * Change schedule, queue or params. Null arguments keep the current value.
     * A schedule change restarts the job at the new schedule's first run.
     */
    public Job updateJob(String jobId, String schedule, String queue, String params) {
        Job current = requireJob(jobId);
        RegisteredTask task = requireTask(current.taskType());

        String newSchedule = schedule != null ? schedule.trim() : current.schedule();
        Instant nextRun = current.nextRun();
        if (schedule != null) {
            nextRun = parseSchedule(newSchedule).initialRun(now());
        }
        String newQueue = queue != null ? resolveQueue(queue, task) : current.queue();
        String newParams = params != null ? normalizeParams(params) : current.params();

        jobRepository.update(jobId, newSchedule, newQueue, newParams, nextRun);
        log.info("Updated job {}: schedule {}, queue {}, next run {}", jobId, newSchedule, newQueue, nextRun);
        return requireJob(jobId);
    }

    /** Enable a job; it runs next at its schedule's first run from now. */
    public Job enableJob(String jobId) {
        Job current = requireJob(jobId);
        Instant nextRun = parseSchedule(current.schedule()).initialRun(now());
        jobRepository.enable(jobId, nextRun);
        log.info("Enabled job {}, next run {}", jobId, nextRun);
        return requireJob(jobId);
    }

    public Job disableJob(String jobId, String reason) {
        requireJob(jobId);
        jobRepository.disable(jobId, reason != null ? reason : "disabled by operator");
        log.info("Disabled job {}: {}", jobId, reason);
        return requireJob(jobId);
    }

    public boolean deleteJob(String jobId) {
        boolean deleted = jobRepository.delete(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    public Optional<Job> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> listJobs() {
        return jobRepository.findAll();
    }

    private Job requireJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobId));
    }

    private RegisteredTask requireTask(String taskType) {
        return registry.require(taskType);
    }

    /** Parse a schedule and make sure it can fire at least once from now. */
    private Schedule parseSchedule(String schedule) {
        try {
            Schedule parsed = Schedules.parse(schedule);
            Instant now = now();
            parsed.nextRun(parsed.initialRun(now), now);
            return parsed;
        } catch (ScheduleException e) {
            throw new IllegalArgumentException("Invalid schedule: " + e.getMessage(), e);
        }
    }

    private String resolveQueue(String queue, RegisteredTask task) {
        if (queue == null || queue.isBlank()) {
            return task.queue();
        }
        String name = QueueBinding.validateName(queue.trim());
        if (!registry.isDeclaredQueue(name)) {
            throw new IllegalArgumentException("Queue " + name + " is not declared; known queues are "
                    + registry.declaredQueues());
        }
        return name;
    }

    private static String normalizeParams(String params) {
        return Json.normalize(params);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
