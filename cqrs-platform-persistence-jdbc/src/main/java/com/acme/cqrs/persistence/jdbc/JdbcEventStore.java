package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.core.ConcurrencyConflictException;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.spi.TransactionalEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Event store over the {@code domain_event} table using the Template Method pattern; subclasses
 * supply the dialect specific SQL.
 *
 * <p>An append reads the stream version and inserts the new rows in one transaction. The primary
 * key {@code (aggregate_id, aggregate_version)} catches writers that raced past the version check;
 * their duplicate key error surfaces as a {@link ConcurrencyConflictException}.
 */
public abstract class JdbcEventStore implements TransactionalEventStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcEventStore.class);

    protected final DataSource dataSource;
    protected final EventCodec codec;

    protected JdbcEventStore(DataSource dataSource, EventCodec codec) {
        this.dataSource = dataSource;
        this.codec = codec;
    }

    protected abstract String getInsertEventSql();

    /** Selects the stream's current version; may lock the stream's last row. */
    protected abstract String getCurrentVersionSql();

    protected abstract String getSelectEventsSql();

    protected abstract String getDeleteStreamSql();

    @Override
    public void append(String aggregateId, long expectedVersion, List<? extends DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        long expected = expectedVersion == ANY_VERSION
                ? events.get(0).getAggregateVersion() - 1
                : expectedVersion;

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                long current = currentVersion(conn, aggregateId);
                if (current != expected) {
                    throw new ConcurrencyConflictException(aggregateId, expected, current);
                }
                insertEvents(conn, aggregateId, current, events);
                conn.commit();
                LOG.debug("Appended {} events to {} (now at version {})",
                        events.size(), aggregateId, current + events.size());
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.warn("Concurrent append detected on {} at version {}", aggregateId, expected + 1);
                throw new ConcurrencyConflictException(aggregateId, expected, e);
            }
            throw ExceptionTranslator.translate(e, "append events to " + aggregateId, LOG);
        }
    }

    private void insertEvents(Connection conn, String aggregateId, long current,
                              List<? extends DomainEvent> events) throws SQLException {
        long next = current + 1;
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.getAggregateId()) || event.getAggregateVersion() != next) {
                throw new ConcurrencyConflictException(aggregateId, next - 1, current);
            }
            next++;
        }

        Timestamp recordedAt = Timestamp.from(Instant.now());
        try (PreparedStatement ps = conn.prepareStatement(getInsertEventSql())) {
            for (DomainEvent event : events) {
                ps.setString(1, event.getEventId().toString());
                ps.setString(2, aggregateId);
                ps.setLong(3, event.getAggregateVersion());
                ps.setString(4, event.eventType());
                ps.setString(5, event.getTenantId());
                ps.setString(6, codec.encode(event));
                ps.setTimestamp(7, Timestamp.from(event.getOccurredAt()));
                ps.setTimestamp(8, recordedAt);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private long currentVersion(Connection conn, String aggregateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getCurrentVersionSql())) {
            ps.setString(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    @Override
    public List<DomainEvent> readEvents(String aggregateId, Long fromVersion, Long toVersion) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectEventsSql())) {

            ps.setString(1, aggregateId);
            ps.setLong(2, fromVersion == null ? 1L : fromVersion);
            ps.setLong(3, toVersion == null ? Long.MAX_VALUE : toVersion);

            List<DomainEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(codec.decode(rs.getString("event_type"), rs.getString("payload")));
                }
            }
            return events;

        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "read events of " + aggregateId, LOG);
        }
    }

    @Override
    public long readVersion(String aggregateId) {
        try (Connection conn = dataSource.getConnection()) {
            return currentVersion(conn, aggregateId);
        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "read version of " + aggregateId, LOG);
        }
    }

    @Override
    public boolean delete(String aggregateId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getDeleteStreamSql())) {

            ps.setString(1, aggregateId);
            int deleted = ps.executeUpdate();
            LOG.debug("Deleted {} events of {}", deleted, aggregateId);
            return deleted > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "delete stream " + aggregateId, LOG);
        }
    }

    /** Deletes every listed stream in one transaction and returns how many existed. */
    @Override
    public int deleteAll(Collection<String> aggregateIds) {
        if (aggregateIds.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(getDeleteStreamSql())) {
                for (String aggregateId : aggregateIds) {
                    ps.setString(1, aggregateId);
                    ps.addBatch();
                }
                int removed = 0;
                for (int count : ps.executeBatch()) {
                    if (count > 0) {
                        removed++;
                    }
                }
                conn.commit();
                return removed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translate(e, "delete " + aggregateIds.size() + " streams", LOG);
        }
    }
}
