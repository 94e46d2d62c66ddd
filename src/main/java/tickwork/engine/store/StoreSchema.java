package tickwork.engine.store;

import java.util.List;

/**
 * DDL for job definitions and execution results.
 */
public final class StoreSchema {

    private StoreSchema() {
    }

    public static final List<String> STATEMENTS = List.of(
            // ---------- JOBS ----------
            """
                    CREATE TABLE IF NOT EXISTS jobs (
                        id              VARCHAR(64) PRIMARY KEY,
                        name            VARCHAR(256) NOT NULL,
                        task_type       VARCHAR(128) NOT NULL,
                        schedule        VARCHAR(256) NOT NULL,
                        queue           VARCHAR(128),
                        params          TEXT NOT NULL,
                        enabled         BOOLEAN DEFAULT TRUE,
                        next_run        TIMESTAMP,
                        last_run        TIMESTAMP,
                        disabled_reason VARCHAR(1024),
                        created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        updated_at      TIMESTAMP
                    )
                    """,

            // ---------- EXECUTION RESULTS ----------
            """
                    CREATE TABLE IF NOT EXISTS execution_results (
                        id              VARCHAR(64) PRIMARY KEY,
                        message_id      VARCHAR(64) NOT NULL,
                        job_id          VARCHAR(64),
                        task_type       VARCHAR(128) NOT NULL,
                        queue           VARCHAR(128),
                        attempt         INT NOT NULL,
                        status          VARCHAR(20) NOT NULL,
                        terminal        BOOLEAN DEFAULT FALSE,
                        output          TEXT,
                        error           VARCHAR(4096),
                        started_at      TIMESTAMP,
                        finished_at     TIMESTAMP,
                        worker_id       VARCHAR(128)
                    )
                    """,

            "CREATE INDEX IF NOT EXISTS idx_jobs_due ON jobs(enabled, next_run)",
            "CREATE INDEX IF NOT EXISTS idx_results_job ON execution_results(job_id, finished_at)",
            "CREATE INDEX IF NOT EXISTS idx_results_message ON execution_results(message_id, attempt)",
            "CREATE INDEX IF NOT EXISTS idx_results_finished ON execution_results(finished_at)");
}
