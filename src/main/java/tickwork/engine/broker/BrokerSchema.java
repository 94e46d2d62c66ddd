package tickwork.engine.broker;

import java.util.List;

/**
 * DDL for queue messages, dead letters and ephemeral locks.
 */
public final class BrokerSchema {

    private BrokerSchema() {
    }

    public static final List<String> STATEMENTS = List.of(
            // ---------- QUEUE MESSAGES ----------
            """
                    CREATE TABLE IF NOT EXISTS queue_messages (
                        id              VARCHAR(64) PRIMARY KEY,
                        queue           VARCHAR(128) NOT NULL,
                        job_id          VARCHAR(64),
                        task_type       VARCHAR(128) NOT NULL,
                        params          TEXT NOT NULL,
                        enqueued_at     TIMESTAMP NOT NULL,
                        visible_at      TIMESTAMP NOT NULL,
                        attempts        INT DEFAULT 0,
                        max_attempts    INT DEFAULT 3,
                        receipt         VARCHAR(64),
                        delivered_at    TIMESTAMP,
                        last_error      VARCHAR(2048),
                        version         BIGINT DEFAULT 0
                    )
                    """,

            // ---------- DEAD LETTERS ----------
            """
                    CREATE TABLE IF NOT EXISTS dead_letters (
                        message_id       VARCHAR(64) PRIMARY KEY,
                        queue            VARCHAR(128) NOT NULL,
                        job_id           VARCHAR(64),
                        task_type        VARCHAR(128) NOT NULL,
                        params           TEXT NOT NULL,
                        attempts         INT NOT NULL,
                        error            VARCHAR(2048),
                        enqueued_at      TIMESTAMP,
                        dead_lettered_at TIMESTAMP NOT NULL
                    )
                    """,

            // ---------- LOCKS ----------
            """
                    CREATE TABLE IF NOT EXISTS broker_locks (
                        lock_key        VARCHAR(256) PRIMARY KEY,
                        owner           VARCHAR(128) NOT NULL,
                        acquired_at     TIMESTAMP NOT NULL,
                        expires_at      TIMESTAMP NOT NULL
                    )
                    """,

            "CREATE INDEX IF NOT EXISTS idx_messages_queue_visible ON queue_messages(queue, visible_at, enqueued_at)",
            "CREATE INDEX IF NOT EXISTS idx_messages_visible ON queue_messages(visible_at)",
            "CREATE INDEX IF NOT EXISTS idx_dead_letters_queue ON dead_letters(queue, dead_lettered_at)");
}
