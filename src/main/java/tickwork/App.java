package tickwork;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickwork.engine.config.Dependencies;
import tickwork.engine.config.EngineConfig;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point.
 *
 * <pre>
 * java -jar tickwork.jar scheduler   # one active scheduler (others stand by)
 * java -jar tickwork.jar worker      # QUEUES / WORKERS_COUNT from the environment
 * java -jar tickwork.jar all         # both in one JVM, for development
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    enum Role {
        SCHEDULER, WORKER, ALL;

        static Role parse(String value) {
            try {
                return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown role '" + value + "', expected scheduler, worker or all", e);
            }
        }

        boolean runsScheduler() {
            return this != WORKER;
        }

        boolean runsWorkers() {
            return this != SCHEDULER;
        }
    }

    private App() {
    }

    public static void main(String[] args) {
        Role role;
        try {
            role = Role.parse(args.length > 0 ? args[0] : "all");
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.exit(2);
            return;
        }

        Dependencies deps;
        try {
            EngineConfig config = EngineConfig.fromEnv();
            deps = Dependencies.create(config);
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        try {
            if (role.runsWorkers()) {
                deps.startWorkers();
            }
            if (role.runsScheduler()) {
                deps.startScheduler();
            }
            deps.startOpsServer();
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            deps.close();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down {}", role.name().toLowerCase(Locale.ROOT));
            deps.close();
            stopped.countDown();
        }, "tickwork-shutdown"));

        log.info("Tickwork {} started", role.name().toLowerCase(Locale.ROOT));
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
