package com.taskledger.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates the ledger tables and their indexes if they do not exist yet.
 * Safe to call repeatedly; the DDL only runs once per initializer instance.
 */
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS memory_store (
                id             BIGSERIAL PRIMARY KEY,
                namespace_path TEXT[] NOT NULL,
                key            TEXT NOT NULL,
                value          JSONB NOT NULL,
                metadata       JSONB DEFAULT '{}',
                expires_at     TIMESTAMP WITH TIME ZONE,
                created_at     TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                updated_at     TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                UNIQUE (namespace_path, key)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_store_namespace_key ON memory_store(namespace_path, key)",
            "CREATE INDEX IF NOT EXISTS idx_memory_store_expires_at ON memory_store(expires_at)",
            """
            CREATE TABLE IF NOT EXISTS task_plans (
                id                              BIGSERIAL PRIMARY KEY,
                plan_id                         VARCHAR(255) NOT NULL,
                batch_index                     INTEGER NOT NULL CHECK (batch_index >= 0),
                task_id                         VARCHAR(64) NOT NULL UNIQUE,
                tool_name                       VARCHAR(255) NOT NULL,
                description                     TEXT,
                parameters                      JSONB,
                complexity                      VARCHAR(20) CHECK (complexity IN ('low', 'medium', 'high')),
                is_required_validate_by_database BOOLEAN DEFAULT false,
                status                          VARCHAR(20) DEFAULT 'pending'
                                                CHECK (status IN ('pending', 'running', 'completed', 'failed')),
                result                          JSONB,
                error_message                   TEXT,
                created_at                      TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                updated_at                      TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                started_at                      TIMESTAMP WITH TIME ZONE,
                completed_at                    TIMESTAMP WITH TIME ZONE
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_task_plans_plan_id ON task_plans(plan_id)",
            "CREATE INDEX IF NOT EXISTS idx_task_plans_batch_index ON task_plans(plan_id, batch_index)",
            "CREATE INDEX IF NOT EXISTS idx_task_plans_tool_name ON task_plans(tool_name)",
            "CREATE INDEX IF NOT EXISTS idx_task_plans_status ON task_plans(status)",
            """
            CREATE TABLE IF NOT EXISTS plan_progress (
                id                   BIGSERIAL PRIMARY KEY,
                plan_id              VARCHAR(255) NOT NULL UNIQUE,
                total_batches        INTEGER NOT NULL DEFAULT 0,
                completed_batches    INTEGER NOT NULL DEFAULT 0,
                failed_batches       INTEGER NOT NULL DEFAULT 0,
                current_batch_index  INTEGER NOT NULL DEFAULT 0,
                overall_success_rate DECIMAL(5,2) DEFAULT 0.00,
                status               VARCHAR(20) DEFAULT 'planning'
                                     CHECK (status IN ('planning', 'running', 'completed', 'failed', 'paused')),
                created_at           TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                last_updated         TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                CHECK (current_batch_index <= total_batches)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_plan_progress_status ON plan_progress(status)",
            "CREATE INDEX IF NOT EXISTS idx_plan_progress_last_updated ON plan_progress(last_updated DESC)",
            """
            CREATE TABLE IF NOT EXISTS task_test (
                id                BIGSERIAL PRIMARY KEY,
                test_id           VARCHAR(255) NOT NULL UNIQUE,
                task_id           VARCHAR(255) NOT NULL,
                thread_id         VARCHAR(255) NOT NULL,
                tool_name         VARCHAR(255) NOT NULL,
                test_data         JSONB NOT NULL,
                test_result       JSONB,
                evaluation_result JSONB,
                status            VARCHAR(20) DEFAULT 'pending'
                                  CHECK (status IN ('pending', 'running', 'completed', 'failed')),
                error_message     TEXT,
                execution_time_ms INTEGER,
                created_at        TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                updated_at        TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                started_at        TIMESTAMP WITH TIME ZONE,
                completed_at      TIMESTAMP WITH TIME ZONE
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_task_test_task_id ON task_test(task_id)",
            "CREATE INDEX IF NOT EXISTS idx_task_test_thread_id ON task_test(thread_id)",
            "CREATE INDEX IF NOT EXISTS idx_task_test_status ON task_test(status)",
            "CREATE INDEX IF NOT EXISTS idx_task_test_created_at ON task_test(created_at DESC)"
    );

    private final DataSource dataSource;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void createTables() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : STATEMENTS) {
                stmt.execute(sql);
            }
            log.info("Ledger schema ensured ({} statements)", STATEMENTS.size());
        } catch (SQLException e) {
            initialized.set(false);
            throw SqlErrors.translate("create ledger schema", e);
        }
    }
}
