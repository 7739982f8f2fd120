package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL dialect of the event store. Payloads are stored as JSONB and the version read at the
 * start of an append locks the stream's last row until the transaction ends.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresEventStore extends JdbcEventStore {

    public PostgresEventStore(DataSource dataSource, EventCodec codec) {
        super(dataSource, codec);
    }

    @Override
    protected String getInsertEventSql() {
        return """
                INSERT INTO cqrs.domain_event
                (event_id, aggregate_id, aggregate_version, event_type, tenant_id, payload,
                 occurred_at, recorded_at)
                VALUES (?::uuid, ?, ?, ?, ?, ?::jsonb, ?, ?)
                """;
    }

    @Override
    protected String getCurrentVersionSql() {
        return """
                SELECT aggregate_version
                FROM cqrs.domain_event
                WHERE aggregate_id = ?
                ORDER BY aggregate_version DESC
                LIMIT 1
                FOR UPDATE
                """;
    }

    @Override
    protected String getSelectEventsSql() {
        return """
                SELECT event_type, payload::text AS payload
                FROM cqrs.domain_event
                WHERE aggregate_id = ? AND aggregate_version BETWEEN ? AND ?
                ORDER BY aggregate_version ASC
                """;
    }

    @Override
    protected String getDeleteStreamSql() {
        return "DELETE FROM cqrs.domain_event WHERE aggregate_id = ?";
    }
}
