package com.example.identity.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.identity.model.AuditLogRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO audit_logs (id, actor_account_id, action, target_account_id, metadata_json, created_at)
        VALUES (:id, :actorAccountId, :action, :targetAccountId, CAST(:metadataJson AS jsonb), :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", auditLogRecord.id())
            .addValue("actorAccountId", auditLogRecord.actorAccountId())
            .addValue("action", auditLogRecord.action())
            .addValue("targetAccountId", auditLogRecord.targetAccountId())
            .addValue("metadataJson", auditLogRecord.metadataJson())
            .addValue("createdAt", toTimestamp(auditLogRecord.createdAt()));
    StoreExceptionTranslator.execute("audit log", () -> jdbcTemplate.update(sql, params));
  }

  public List<AuditLogRecord> findByTargetAccountId(String targetAccountId) {
    final String sql =
        """
        SELECT id, actor_account_id, action, target_account_id, metadata_json::text AS metadata_json, created_at
        FROM audit_logs
        WHERE target_account_id = :targetAccountId
        ORDER BY created_at ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("targetAccountId", targetAccountId);
    return StoreExceptionTranslator.execute(
        "audit log",
        () ->
            jdbcTemplate.query(
                sql,
                params,
                (rs, rowNum) ->
                    new AuditLogRecord(
                        rs.getString("id"),
                        rs.getString("actor_account_id"),
                        rs.getString("action"),
                        rs.getString("target_account_id"),
                        rs.getString("metadata_json"),
                        rs.getTimestamp("created_at").toInstant())));
  }
}
