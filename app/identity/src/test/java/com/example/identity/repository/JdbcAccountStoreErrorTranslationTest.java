package com.example.identity.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.example.identity.model.AuditLogRecord;
import com.example.identity.service.ErrorKind;
import com.example.identity.service.IdentityException;
import com.example.identity.service.InfrastructureException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

@ExtendWith(MockitoExtension.class)
class JdbcAccountStoreErrorTranslationTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private NamedParameterJdbcTemplate jdbcTemplate;

  private JdbcAccountStore store;

  @BeforeEach
  void setUp() {
    store = new JdbcAccountStore(jdbcTemplate);
  }

  @Test
  void columnOverflowBecomesValidationError() {
    when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class)))
        .thenThrow(
            new DataIntegrityViolationException("value too long for type character varying(45)"));

    assertThatThrownBy(() -> store.recordLogin("acc-1", NOW, "x".repeat(46)))
        .isInstanceOfSatisfying(
            IdentityException.class,
            ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.VALIDATION));
  }

  @Test
  @SuppressWarnings("unchecked")
  void queryTimeoutBecomesRetryableTimeout() {
    when(jdbcTemplate.query(anyString(), any(SqlParameterSource.class), any(RowMapper.class)))
        .thenThrow(new QueryTimeoutException("canceling statement due to statement timeout"));

    assertThatThrownBy(() -> store.findById("acc-1"))
        .isInstanceOfSatisfying(
            InfrastructureException.class,
            ex -> assertThat(ex.reason()).isEqualTo(InfrastructureException.Reason.TIMEOUT));
  }

  @Test
  void connectionFailureBecomesUnavailable() {
    when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> store.hardDelete("acc-1"))
        .isInstanceOfSatisfying(
            InfrastructureException.class,
            ex -> assertThat(ex.reason()).isEqualTo(InfrastructureException.Reason.UNAVAILABLE));
  }

  @Test
  void anyOtherDataAccessFailureIsStillTyped() {
    when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class)))
        .thenThrow(new InvalidDataAccessApiUsageException("unexpected parameter"));

    assertThatThrownBy(() -> store.recordLogin("acc-1", NOW, "10.0.0.1"))
        .isInstanceOfSatisfying(
            IdentityException.class,
            ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.INFRASTRUCTURE));
  }

  @Test
  void auditLogWritesAreTranslatedToo() {
    when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class)))
        .thenThrow(new DataIntegrityViolationException("null value in column \"action\""));
    final AuditLogRepository auditLogRepository = new AuditLogRepository(jdbcTemplate);

    assertThatThrownBy(
            () ->
                auditLogRepository.insert(
                    new AuditLogRecord("log-1", "admin-1", null, "acc-1", "{}", NOW)))
        .isInstanceOfSatisfying(
            IdentityException.class,
            ex -> assertThat(ex.kind()).isEqualTo(ErrorKind.VALIDATION));
  }
}
