package db.migration;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Creates the task store, the sequence counters and the activity log.
 */
public class V1__CreateRecurringTaskTables extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        final JdbcTemplate jdbcTemplate = new JdbcTemplate(
            new SingleConnectionDataSource(context.getConnection(), true)
        );

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS task (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                task_id BIGINT NOT NULL,
                user_id BIGINT NOT NULL,
                parent_id BIGINT,
                title VARCHAR(255) NOT NULL,
                description TEXT,
                category VARCHAR(255),
                priority VARCHAR(20),
                due_date DATETIME NOT NULL,
                original_due_date DATETIME,
                completed BOOLEAN NOT NULL DEFAULT FALSE,
                completion_timestamp DATETIME,
                repeat_type VARCHAR(20) NOT NULL DEFAULT 'NONE',
                recurring_parent_id BIGINT,
                additional_notes TEXT,
                created_at DATETIME,
                updated_at DATETIME,
                CONSTRAINT uk_task_task_id UNIQUE (task_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS task_link (
                task_pk BIGINT NOT NULL,
                link VARCHAR(255),
                CONSTRAINT fk_task_link_task FOREIGN KEY (task_pk) REFERENCES task (id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS sequence_counter (
                name VARCHAR(100) PRIMARY KEY,
                sequence_value BIGINT NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS user_activity (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                user_id BIGINT NOT NULL,
                action VARCHAR(255) NOT NULL,
                task_id BIGINT,
                message TEXT NOT NULL,
                error TEXT,
                activity_time DATETIME NOT NULL
            )
        """);

        // chain lookups: children of a root, open instances by due date
        jdbcTemplate.execute("CREATE INDEX idx_task_recurring_parent ON task (recurring_parent_id, completed, due_date)");
        jdbcTemplate.execute("CREATE INDEX idx_task_user ON task (user_id)");
        jdbcTemplate.execute("CREATE INDEX idx_user_activity_user_time ON user_activity (user_id, activity_time)");
        jdbcTemplate.execute("CREATE INDEX idx_user_activity_task ON user_activity (task_id)");
    }
}
