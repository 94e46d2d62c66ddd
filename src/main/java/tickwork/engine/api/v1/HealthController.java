package tickwork.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.api.Controller;
import tickwork.engine.api.v1.dto.HealthResponse;
import tickwork.engine.api.v1.dto.HealthResponse.SchedulerStatus;
import tickwork.engine.api.v1.dto.HealthResponse.WorkerStatus;
import tickwork.engine.api.v1.dto.QueueDepthResponse;
import tickwork.engine.broker.Broker;
import tickwork.engine.config.QueueBinding;
import tickwork.engine.repository.JobRepository;
import tickwork.engine.scheduler.SchedulerLoop;
import tickwork.engine.scheduler.TickReport;
import tickwork.engine.store.Database;
import tickwork.engine.util.Json;
import tickwork.engine.worker.WorkerPool;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * <p>Reports 503 when the store or the broker is unreachable. Scheduler and
 * worker sections appear only for the roles this process runs.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Database store;
    private final Broker broker;
    private final JobRepository jobs;
    private final QueueBinding queues;
    private final Supplier<SchedulerLoop> scheduler;
    private final Supplier<WorkerPool> workers;

    public HealthController(Database store, Broker broker, JobRepository jobs, QueueBinding queues,
            Supplier<SchedulerLoop> scheduler, Supplier<WorkerPool> workers) {
        this.store = store;
        this.broker = broker;
        this.jobs = jobs;
        this.queues = queues;
        this.scheduler = scheduler;
        this.workers = workers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HealthResponse response = check();
            HttpResponseStatus status = "healthy".equals(response.status())
                    ? HttpResponseStatus.OK
                    : HttpResponseStatus.SERVICE_UNAVAILABLE;
            return ControllerResponse.json(status, Json.MAPPER.writeValueAsString(response));
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.errorJson(HttpResponseStatus.SERVICE_UNAVAILABLE, "health check failed");
        }
    }

    public HealthResponse check() {
        boolean storeOk = store.isHealthy();
        boolean brokerOk = broker.isHealthy();
        if (!storeOk || !brokerOk) {
            return HealthResponse.unhealthy(storeOk ? "ok" : "connection failed",
                    brokerOk ? "ok" : "connection failed");
        }

        List<QueueDepthResponse> depths = queues.names().stream()
                .map(broker::stats)
                .map(QueueDepthResponse::from)
                .toList();

        return HealthResponse.healthy(formatUptime(), VERSION, jobs.countEnabled(), broker.deadLetterCount(),
                depths, schedulerStatus(), workerStatus());
    }

    private SchedulerStatus schedulerStatus() {
        SchedulerLoop loop = scheduler.get();
        if (loop == null) {
            return null;
        }
        TickReport last = loop.lastReport();
        return new SchedulerStatus(loop.instanceId(), loop.isRunning(), loop.isLeader(),
                last != null ? last.tickTime().toString() : null,
                last != null ? last.enqueued() : null);
    }

    private WorkerStatus workerStatus() {
        WorkerPool pool = workers.get();
        if (pool == null) {
            return null;
        }
        return new WorkerStatus(pool.workerId(), pool.isRunning(), pool.inFlight(), pool.processed(), pool.failed());
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
