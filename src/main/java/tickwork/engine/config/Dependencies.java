package tickwork.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.api.v1.HealthController;
import tickwork.engine.api.v1.ResultController;
import tickwork.engine.broker.BrokerSchema;
import tickwork.engine.broker.JdbcBroker;
import tickwork.engine.broker.JdbcLockManager;
import tickwork.engine.registry.TaskRegistry;
import tickwork.engine.scheduler.JobScheduler;
import tickwork.engine.scheduler.SchedulerLoop;
import tickwork.engine.server.OpsServer;
import tickwork.engine.server.RouterHandler;
import tickwork.engine.service.DispatchService;
import tickwork.engine.service.JobService;
import tickwork.engine.service.ResultService;
import tickwork.engine.store.Database;
import tickwork.engine.store.JdbcExecutionResultRepository;
import tickwork.engine.store.JdbcJobRepository;
import tickwork.engine.store.StoreSchema;
import tickwork.engine.tasks.BuiltinTasks;
import tickwork.engine.worker.ResultWriter;
import tickwork.engine.worker.WorkerIdentity;
import tickwork.engine.worker.WorkerPool;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.registry().register("refresh_schema", "schemas", new RefreshSchemaTask());
 * deps.startScheduler();
 * deps.startWorkers();
 * // ...
 * deps.close();
 * </pre>
 *
 * When broker and store URLs are equal both use one pool, which lets results
 * and lock releases commit in one transaction.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final Database storeDatabase;
    private final Database brokerDatabase;
    private final JdbcJobRepository jobRepository;
    private final JdbcExecutionResultRepository resultRepository;
    private final JdbcBroker broker;
    private final JdbcLockManager lockManager;
    private final TaskRegistry registry;
    private final ResultWriter resultWriter;
    private final JobService jobService;
    private final DispatchService dispatchService;
    private final ResultService resultService;

    // Controllers
    private final HealthController healthController;
    private final ResultController resultController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private SchedulerLoop schedulerLoop;
    private WorkerPool workerPool;
    private OpsServer opsServer;

    private Dependencies(EngineConfig config, Clock clock) {
        this.config = config.validate();
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.storeDatabase = new Database(config.databaseUrl(), config.databasePoolSize(), "tickwork-store")
                .initSchema("store", StoreSchema.STATEMENTS);
        if (config.sharedBrokerDatabase()) {
            this.brokerDatabase = storeDatabase.initSchema("broker", BrokerSchema.STATEMENTS);
        } else {
            Database separate = null;
            try {
                separate = new Database(config.brokerUrl(), config.databasePoolSize(), "tickwork-broker");
                this.brokerDatabase = separate.initSchema("broker", BrokerSchema.STATEMENTS);
            } catch (RuntimeException e) {
                if (separate != null) {
                    separate.close();
                }
                storeDatabase.close();
                throw e;
            }
        }

        // Repositories and broker
        this.jobRepository = new JdbcJobRepository(storeDatabase, clock);
        this.resultRepository = new JdbcExecutionResultRepository(storeDatabase);
        this.broker = new JdbcBroker(brokerDatabase, clock);
        this.lockManager = new JdbcLockManager(brokerDatabase, clock);

        // Tasks
        this.registry = BuiltinTasks.register(new TaskRegistry(), resultRepository, config, clock);
        this.resultWriter = new ResultWriter(resultRepository, broker, lockManager, config);

        // Services
        this.jobService = new JobService(jobRepository, registry, clock);
        this.dispatchService = new DispatchService(broker, registry, config, clock);
        this.resultService = new ResultService(resultRepository, broker);

        // Controllers
        this.healthController = new HealthController(storeDatabase, broker, jobRepository, config.queues(),
                this::schedulerLoopIfStarted, this::workerPoolIfStarted);
        this.resultController = new ResultController(jobService, resultService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     *
     * @throws tickwork.engine.store.StoreException if a database cannot be reached
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    public static Dependencies create(EngineConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database storeDatabase() {
        return storeDatabase;
    }

    public Database brokerDatabase() {
        return brokerDatabase;
    }

    public JdbcJobRepository jobRepository() {
        return jobRepository;
    }

    public JdbcExecutionResultRepository resultRepository() {
        return resultRepository;
    }

    public JdbcBroker broker() {
        return broker;
    }

    public JdbcLockManager lockManager() {
        return lockManager;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public ResultWriter resultWriter() {
        return resultWriter;
    }

    public JobService jobService() {
        return jobService;
    }

    public DispatchService dispatchService() {
        return dispatchService;
    }

    public ResultService resultService() {
        return resultService;
    }

    public HealthController healthController() {
        return healthController;
    }

    public ResultController resultController() {
        return resultController;
    }

    /**
     * Get a RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(resultController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler loop (creates it if not yet created).
     */
    public synchronized SchedulerLoop schedulerLoop() {
        if (schedulerLoop == null) {
            JobScheduler jobScheduler = new JobScheduler(jobRepository, broker, lockManager, registry, config, clock);
            schedulerLoop = new SchedulerLoop(jobScheduler, lockManager, config, WorkerIdentity.generate("scheduler"));
        }
        return schedulerLoop;
    }

    /**
     * Get the worker pool (creates it if not yet created).
     */
    public synchronized WorkerPool workerPool() {
        if (workerPool == null) {
            workerPool = new WorkerPool(broker, registry, resultWriter, config, clock,
                    WorkerIdentity.generate("worker"));
        }
        return workerPool;
    }

    public synchronized OpsServer opsServer() {
        if (opsServer == null) {
            opsServer = new OpsServer(config.opsHost(), config.opsPort(), routerHandler());
        }
        return opsServer;
    }

    public void startScheduler() {
        schedulerLoop().start();
    }

    /**
     * Start the worker pool.
     *
     * @throws IllegalStateException if the queue binding names undeclared queues
     */
    public void startWorkers() {
        workerPool().start();
    }

    public void startOpsServer() {
        if (!config.opsEnabled()) {
            log.info("Ops server disabled");
            return;
        }
        opsServer().start();
    }

    private synchronized SchedulerLoop schedulerLoopIfStarted() {
        return schedulerLoop;
    }

    private synchronized WorkerPool workerPoolIfStarted() {
        return workerPool;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        OpsServer server;
        WorkerPool pool;
        SchedulerLoop loop;
        synchronized (this) {
            server = opsServer;
            pool = workerPool;
            loop = schedulerLoop;
        }

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping ops server: {}", e.getMessage());
            }
        }

        // Stop taking work before the scheduler, so in-flight tasks can still settle
        if (pool != null) {
            try {
                pool.shutdown();
            } catch (Exception e) {
                log.warn("Error stopping worker pool: {}", e.getMessage());
            }
        }

        if (loop != null) {
            try {
                loop.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (brokerDatabase != storeDatabase) {
            try {
                brokerDatabase.close();
            } catch (Exception e) {
                log.warn("Error closing broker database: {}", e.getMessage());
            }
        }
        try {
            storeDatabase.close();
        } catch (Exception e) {
            log.warn("Error closing store database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
