package com.acme.cqrs.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.acme.cqrs.core.PermanentException;
import com.acme.cqrs.core.PersistenceException;
import com.acme.cqrs.core.TransientException;
import java.sql.BatchUpdateException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class ExceptionTranslatorTest {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionTranslatorTest.class);

  @Nested
  @DisplayName("Transient Error Detection")
  class TransientErrorTests {

    @Test
    @DisplayName("should return PersistenceException for connection failures")
    void testConnectionFailure() {
      SQLException cause = new SQLException("Connection refused to host", "08001");

      RuntimeException result = ExceptionTranslator.translate(cause, "append", logger);

      assertThat(result).isInstanceOf(PersistenceException.class).isInstanceOf(TransientException.class);
      assertThat(result.getMessage()).startsWith("append failed").contains("Connection refused");
      assertThat(result.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("should return PersistenceException for serialization failure")
    void testRollback() {
      SQLException cause = new SQLException("could not serialize access", "40001");

      assertThat(ExceptionTranslator.translate(cause, "append", logger))
          .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("should return PersistenceException for H2 lock timeout")
    void testLockTimeout() {
      SQLException cause = new SQLException("Timeout trying to lock table", "HYT00", 50200);

      assertThat(ExceptionTranslator.translate(cause, "append", logger))
          .isInstanceOf(PersistenceException.class);
    }

    @Test
    @DisplayName("should default to PersistenceException for unclassified errors")
    void testUnknown() {
      SQLException cause = new SQLException("something odd happened");

      assertThat(ExceptionTranslator.translate(cause, "read", logger))
          .isInstanceOf(PersistenceException.class);
    }
  }

  @Nested
  @DisplayName("Permanent Error Detection")
  class PermanentErrorTests {

    @Test
    @DisplayName("should return PermanentException for missing table")
    void testTableNotFound() {
      SQLException cause = new SQLException("Table \"DOMAIN_EVENT\" not found", "42S02", 42102);

      RuntimeException result = ExceptionTranslator.translate(cause, "read", logger);

      assertThat(result).isInstanceOf(PermanentException.class);
      assertThat(result).isNotInstanceOf(TransientException.class);
    }

    @Test
    @DisplayName("should return PermanentException for data exceptions")
    void testDataException() {
      SQLException cause = new SQLException("value too long for column", "22001");

      assertThat(ExceptionTranslator.translate(cause, "append", logger))
          .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("should return PermanentException for syntax errors")
    void testSyntaxError() {
      SQLException cause = new SQLException("Syntax error in SQL statement", "42000");

      assertThat(ExceptionTranslator.translate(cause, "append", logger))
          .isInstanceOf(PermanentException.class);
    }
  }

  @Nested
  @DisplayName("Unique Violation Detection")
  class UniqueViolationTests {

    @Test
    @DisplayName("should detect duplicate key by SQLState")
    void testDirect() {
      assertThat(ExceptionTranslator.isUniqueViolation(
          new SQLException("Unique index or primary key violation", "23505"))).isTrue();
    }

    @Test
    @DisplayName("should detect duplicate key chained behind a batch failure")
    void testChained() {
      BatchUpdateException batch = new BatchUpdateException("batch failed", new int[0]);
      batch.setNextException(new SQLException("duplicate key value", "23505"));

      assertThat(ExceptionTranslator.isUniqueViolation(batch)).isTrue();
    }

    @Test
    @DisplayName("should not treat other constraint violations as duplicates")
    void testOtherConstraint() {
      assertThat(ExceptionTranslator.isUniqueViolation(
          new SQLException("null value in column", "23502"))).isFalse();
    }
  }
}
