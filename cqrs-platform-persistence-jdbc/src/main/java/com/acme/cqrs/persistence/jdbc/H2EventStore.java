package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2 dialect of the event store, used for tests and embedded deployments. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2EventStore extends JdbcEventStore {

    public H2EventStore(DataSource dataSource, EventCodec codec) {
        super(dataSource, codec);
    }

    @Override
    protected String getInsertEventSql() {
        return """
                INSERT INTO domain_event
                (event_id, aggregate_id, aggregate_version, event_type, tenant_id, payload,
                 occurred_at, recorded_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getCurrentVersionSql() {
        return """
                SELECT COALESCE(MAX(aggregate_version), 0)
                FROM domain_event
                WHERE aggregate_id = ?
                """;
    }

    @Override
    protected String getSelectEventsSql() {
        return """
                SELECT event_type, payload
                FROM domain_event
                WHERE aggregate_id = ? AND aggregate_version BETWEEN ? AND ?
                ORDER BY aggregate_version ASC
                """;
    }

    @Override
    protected String getDeleteStreamSql() {
        return "DELETE FROM domain_event WHERE aggregate_id = ?";
    }
}
