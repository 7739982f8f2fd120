package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/** H2 dialect of the snapshot store. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2SnapshotStore extends JdbcSnapshotStore {

    public H2SnapshotStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getUpsertSql() {
        return """
                MERGE INTO aggregate_snapshot t
                USING (SELECT CAST(? AS VARCHAR(255)) AS aggregate_id,
                              CAST(? AS VARCHAR(255)) AS aggregate_type,
                              CAST(? AS BIGINT) AS aggregate_version,
                              CAST(? AS CLOB) AS state,
                              CAST(? AS TIMESTAMP) AS created_at) s
                ON t.aggregate_id = s.aggregate_id
                WHEN MATCHED AND t.aggregate_version < s.aggregate_version THEN
                  UPDATE SET aggregate_type = s.aggregate_type,
                             aggregate_version = s.aggregate_version,
                             state = s.state,
                             created_at = s.created_at
                WHEN NOT MATCHED THEN
                  INSERT (aggregate_id, aggregate_type, aggregate_version, state, created_at)
                  VALUES (s.aggregate_id, s.aggregate_type, s.aggregate_version, s.state, s.created_at)
                """;
    }

    @Override
    protected String getSelectSql() {
        return """
                SELECT aggregate_id, aggregate_type, aggregate_version, state, created_at
                FROM aggregate_snapshot
                WHERE aggregate_id = ?
                """;
    }

    @Override
    protected String getDeleteSql() {
        return "DELETE FROM aggregate_snapshot WHERE aggregate_id = ?";
    }
}
