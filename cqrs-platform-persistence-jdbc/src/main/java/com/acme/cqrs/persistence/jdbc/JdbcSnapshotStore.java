package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.aggregate.Snapshot;
import com.acme.cqrs.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;

/**
 * Snapshot store over the {@code aggregate_snapshot} table, one row per aggregate. The upsert
 * supplied by the dialect only replaces a row holding an older version.
 */
public abstract class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    protected final DataSource dataSource;

    protected JdbcSnapshotStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Parameters in order: aggregate id, aggregate type, version, state, created at.
     */
    protected abstract String getUpsertSql();

    protected abstract String getSelectSql();

    protected abstract String getDeleteSql();

    @Override
    public Optional<Snapshot> get(String aggregateId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectSql())) {

            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Snapshot(
                            rs.getString("aggregate_id"),
                            rs.getString("aggregate_type"),
                            rs.getLong("aggregate_version"),
                            rs.getString("state"),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "read snapshot of " + aggregateId, LOG);
        }
    }

    @Override
    public void put(Snapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertSql())) {

            ps.setString(1, snapshot.aggregateId());
            ps.setString(2, snapshot.aggregateType());
            ps.setLong(3, snapshot.version());
            ps.setString(4, snapshot.state());
            ps.setTimestamp(5, Timestamp.from(snapshot.createdAt()));

            if (ps.executeUpdate() == 0) {
                LOG.debug("Kept newer snapshot of {}, version {} ignored",
                        snapshot.aggregateId(), snapshot.version());
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "write snapshot of " + snapshot.aggregateId(), LOG);
        }
    }

    @Override
    public boolean delete(String aggregateId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteSql())) {

            ps.setString(1, aggregateId);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "delete snapshot of " + aggregateId, LOG);
        }
    }
}
