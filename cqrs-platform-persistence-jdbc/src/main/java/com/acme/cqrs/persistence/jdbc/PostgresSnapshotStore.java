package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** PostgreSQL dialect of the snapshot store; state is kept as JSONB. */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresSnapshotStore extends JdbcSnapshotStore {

    public PostgresSnapshotStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                INSERT INTO cqrs.aggregate_snapshot
                (aggregate_id, aggregate_type, aggregate_version, state, created_at)
                VALUES (?, ?, ?, ?::jsonb, ?)
                ON CONFLICT (aggregate_id) DO UPDATE
                SET aggregate_type = EXCLUDED.aggregate_type,
                    aggregate_version = EXCLUDED.aggregate_version,
                    state = EXCLUDED.state,
                    created_at = EXCLUDED.created_at
                WHERE cqrs.aggregate_snapshot.aggregate_version < EXCLUDED.aggregate_version
                """;
    }

    @Override
    protected String getSelectSql() {
        return """
                SELECT aggregate_id, aggregate_type, aggregate_version, state::text AS state,
                       created_at
                FROM cqrs.aggregate_snapshot
                WHERE aggregate_id = ?
                """;
    }

    @Override
    protected String getDeleteSql() {
        return "DELETE FROM cqrs.aggregate_snapshot WHERE aggregate_id = ?";
    }
}
