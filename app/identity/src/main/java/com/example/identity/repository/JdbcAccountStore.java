package com.example.identity.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AccountSearchCriteria;
import com.example.identity.model.AccountStatistics;
import com.example.identity.model.AccountStatus;
import com.example.identity.model.ExternalIdentity;
import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.model.SingleUseTokenSlot;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class JdbcAccountStore implements AccountStore {

  private static final String COLUMNS =
      """
      id, email, username, password_hash, auth_provider, auth_provider_id, email_verified,
      verification_token_digest, verification_token_expires_at,
      password_reset_token_digest, password_reset_token_expires_at,
      first_name, last_name, nickname, phone, avatar_url, bio,
      role, status, is_active, last_login_at, last_login_address,
      created_at, updated_at, deleted_at, version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public AccountRecord save(AccountRecord account) {
    return execute(
        () -> {
          try {
            return account.isNew() ? insert(account) : update(account);
          } catch (DuplicateKeyException ex) {
            throw new UniqueConstraintViolationException(resolveConstraint(ex), ex);
          }
        });
  }

  private AccountRecord insert(AccountRecord account) {
    final String sql =
        """
        INSERT INTO accounts (
            id, email, username, password_hash, auth_provider, auth_provider_id, email_verified,
            verification_token_digest, verification_token_expires_at,
            password_reset_token_digest, password_reset_token_expires_at,
            first_name, last_name, nickname, phone, avatar_url, bio,
            role, status, is_active, last_login_at, last_login_address,
            created_at, updated_at, deleted_at, version)
        VALUES (
            :id, :email, :username, :passwordHash, :provider, :providerId, :emailVerified,
            :verificationDigest, :verificationExpiresAt,
            :resetDigest, :resetExpiresAt,
            :firstName, :lastName, :nickname, :phone, :avatarUrl, :bio,
            :role, :status, :active, :lastLoginAt, :lastLoginAddress,
            :createdAt, :updatedAt, :deletedAt, 1)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        toParams(account)
            .addValue("lastLoginAt", toTimestamp(account.lastLoginAt()))
            .addValue("lastLoginAddress", account.lastLoginAddress())
            .addValue("createdAt", toTimestamp(account.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private AccountRecord update(AccountRecord account) {
    // last_login_* は recordLogin 専用のため、ここでは書き換えない
    final String sql =
        """
        UPDATE accounts
        SET email = :email,
            username = :username,
            password_hash = :passwordHash,
            auth_provider = :provider,
            auth_provider_id = :providerId,
            email_verified = :emailVerified,
            verification_token_digest = :verificationDigest,
            verification_token_expires_at = :verificationExpiresAt,
            password_reset_token_digest = :resetDigest,
            password_reset_token_expires_at = :resetExpiresAt,
            first_name = :firstName,
            last_name = :lastName,
            nickname = :nickname,
            phone = :phone,
            avatar_url = :avatarUrl,
            bio = :bio,
            role = :role,
            status = :status,
            is_active = :active,
            updated_at = :updatedAt,
            deleted_at = COALESCE(deleted_at, :deletedAt),
            version = version + 1
        WHERE id = :id AND version = :version
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params = toParams(account).addValue("version", account.version());
    return jdbcTemplate.query(sql, params, this::mapRow).stream()
        .findFirst()
        .orElseThrow(() -> new StaleAccountException(account.id()));
  }

  @Override
  public Optional<AccountRecord> findById(String id) {
    final String sql = "SELECT " + COLUMNS + " FROM accounts WHERE id = :id";
    return queryOne(sql, new MapSqlParameterSource().addValue("id", id));
  }

  @Override
  public Optional<AccountRecord> findByEmail(String email) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM accounts
            WHERE email = :email
            ORDER BY (deleted_at IS NULL) DESC, deleted_at DESC
            LIMIT 1
            """;
    return queryOne(sql, new MapSqlParameterSource().addValue("email", email));
  }

  @Override
  public Optional<AccountRecord> findByUsername(String username) {
    final String sql =
        "SELECT " + COLUMNS + " FROM accounts WHERE username = :username AND deleted_at IS NULL";
    return queryOne(sql, new MapSqlParameterSource().addValue("username", username));
  }

  @Override
  public Optional<AccountRecord> findByExternalIdentity(String provider, String providerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM accounts WHERE auth_provider = :provider AND auth_provider_id = :providerId";
    return queryOne(
        sql,
        new MapSqlParameterSource().addValue("provider", provider).addValue("providerId", providerId));
  }

  @Override
  public Optional<AccountRecord> findBySingleUseToken(
      String digest, SingleUseTokenPurpose purpose) {
    final String column =
        switch (purpose) {
          case EMAIL_VERIFICATION -> "verification_token_digest";
          case PASSWORD_RESET -> "password_reset_token_digest";
        };
    final String sql =
        "SELECT " + COLUMNS + " FROM accounts WHERE " + column + " = :digest AND deleted_at IS NULL";
    return queryOne(sql, new MapSqlParameterSource().addValue("digest", digest));
  }

  @Override
  public boolean existsByEmail(String email, boolean excludeDeleted) {
    return exists("email", email, excludeDeleted);
  }

  @Override
  public boolean existsByUsername(String username, boolean excludeDeleted) {
    return exists("username", username, excludeDeleted);
  }

  private boolean exists(String column, String value, boolean excludeDeleted) {
    final String sql =
        "SELECT EXISTS (SELECT 1 FROM accounts WHERE "
            + column
            + " = :value"
            + (excludeDeleted ? " AND deleted_at IS NULL" : "")
            + ")";
    return execute(
        () ->
            Boolean.TRUE.equals(
                jdbcTemplate.queryForObject(
                    sql, new MapSqlParameterSource().addValue("value", value), Boolean.class)));
  }

  @Override
  public boolean recordLogin(String id, Instant at, String originAddress) {
    final String sql =
        """
        UPDATE accounts
        SET last_login_at = :at,
            last_login_address = COALESCE(:address, last_login_address)
        WHERE id = :id AND status = 'ACTIVE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("at", toTimestamp(at))
            .addValue("address", originAddress);
    return execute(() -> jdbcTemplate.update(sql, params) == 1);
  }

  @Override
  public List<AccountRecord> search(AccountSearchCriteria criteria) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM accounts"
            + buildWhere(criteria, params)
            + " ORDER BY created_at DESC, id ASC LIMIT :limit OFFSET :offset";
    params.addValue("limit", criteria.limit()).addValue("offset", criteria.offset());
    return execute(() -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  @Override
  public long count(AccountSearchCriteria criteria) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT COUNT(*) FROM accounts" + buildWhere(criteria, params);
    return execute(
        () -> {
          final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
          return count == null ? 0L : count;
        });
  }

  @Override
  public AccountStatistics statistics() {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE status = 'PENDING') AS pending,
               COUNT(*) FILTER (WHERE status = 'ACTIVE') AS active,
               COUNT(*) FILTER (WHERE status = 'INACTIVE') AS inactive,
               COUNT(*) FILTER (WHERE status = 'SUSPENDED') AS suspended,
               COUNT(*) FILTER (WHERE status = 'DELETED') AS deleted,
               COUNT(*) FILTER (WHERE role = 'ADMIN') AS admins,
               COUNT(*) FILTER (WHERE email_verified) AS verified,
               COUNT(*) FILTER (WHERE NOT email_verified) AS unverified
        FROM accounts
        """;
    return execute(
        () ->
            jdbcTemplate.queryForObject(
                sql,
                new MapSqlParameterSource(),
                (rs, rowNum) ->
                    new AccountStatistics(
                        rs.getLong("total"),
                        rs.getLong("pending"),
                        rs.getLong("active"),
                        rs.getLong("inactive"),
                        rs.getLong("suspended"),
                        rs.getLong("deleted"),
                        rs.getLong("admins"),
                        rs.getLong("verified"),
                        rs.getLong("unverified"))));
  }

  @Override
  public boolean hardDelete(String id) {
    final String sql = "DELETE FROM accounts WHERE id = :id";
    return execute(
        () -> jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id)) == 1);
  }

  private String buildWhere(AccountSearchCriteria criteria, MapSqlParameterSource params) {
    final List<String> clauses = new ArrayList<>();
    if (criteria.searchTerm() != null) {
      clauses.add(
          "(email LIKE :term OR username LIKE :term OR LOWER(COALESCE(first_name, '')) LIKE :term"
              + " OR LOWER(COALESCE(last_name, '')) LIKE :term"
              + " OR LOWER(COALESCE(nickname, '')) LIKE :term)");
      params.addValue("term", "%" + escapeLike(criteria.searchTerm().toLowerCase(Locale.ROOT)) + "%");
    }
    if (criteria.role() != null) {
      clauses.add("role = :role");
      params.addValue("role", criteria.role().name());
    }
    if (criteria.status() != null) {
      clauses.add("status = :status");
      params.addValue("status", criteria.status().name());
    }
    if (criteria.provider() != null) {
      clauses.add("auth_provider = :provider");
      params.addValue("provider", criteria.provider());
    }
    if (criteria.emailVerified() != null) {
      clauses.add("email_verified = :emailVerified");
      params.addValue("emailVerified", criteria.emailVerified());
    }
    if (criteria.active() != null) {
      clauses.add("is_active = :active");
      params.addValue("active", criteria.active());
    }
    return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
  }

  private String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private Optional<AccountRecord> queryOne(String sql, MapSqlParameterSource params) {
    return execute(() -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  private <T> T execute(Supplier<T> action) {
    return StoreExceptionTranslator.execute("account store", action);
  }

  private UniqueConstraintViolationException.Constraint resolveConstraint(
      DuplicateKeyException ex) {
    final String detail = String.valueOf(ex.getMostSpecificCause().getMessage());
    if (detail.contains("ux_accounts_email_live")) {
      return UniqueConstraintViolationException.Constraint.EMAIL;
    }
    if (detail.contains("ux_accounts_username_live")) {
      return UniqueConstraintViolationException.Constraint.USERNAME;
    }
    if (detail.contains("ux_accounts_external_identity")) {
      return UniqueConstraintViolationException.Constraint.EXTERNAL_IDENTITY;
    }
    if (detail.contains("token_digest")) {
      return UniqueConstraintViolationException.Constraint.SINGLE_USE_TOKEN;
    }
    return UniqueConstraintViolationException.Constraint.ACCOUNT_ID;
  }

  private MapSqlParameterSource toParams(AccountRecord account) {
    final ExternalIdentity external = account.externalIdentity();
    final SingleUseTokenSlot verification = account.verificationToken();
    final SingleUseTokenSlot reset = account.passwordResetToken();
    final AccountProfile profile = account.profile();
    return new MapSqlParameterSource()
        .addValue("id", account.id())
        .addValue("email", account.email())
        .addValue("username", account.username())
        .addValue("passwordHash", account.passwordHash())
        .addValue("provider", external == null ? null : external.provider())
        .addValue("providerId", external == null ? null : external.providerId())
        .addValue("emailVerified", account.emailVerified())
        .addValue("verificationDigest", verification == null ? null : verification.digest())
        .addValue(
            "verificationExpiresAt",
            verification == null ? null : toTimestamp(verification.expiresAt()))
        .addValue("resetDigest", reset == null ? null : reset.digest())
        .addValue("resetExpiresAt", reset == null ? null : toTimestamp(reset.expiresAt()))
        .addValue("firstName", profile.firstName())
        .addValue("lastName", profile.lastName())
        .addValue("nickname", profile.nickname())
        .addValue("phone", profile.phone())
        .addValue("avatarUrl", profile.avatarUrl())
        .addValue("bio", profile.bio())
        .addValue("role", account.role().name())
        .addValue("status", account.status().name())
        .addValue("active", account.active())
        .addValue("updatedAt", toTimestamp(account.updatedAt()))
        .addValue("deletedAt", toTimestamp(account.deletedAt()));
  }

  private AccountRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String provider = rs.getString("auth_provider");
    final String verificationDigest = rs.getString("verification_token_digest");
    final String resetDigest = rs.getString("password_reset_token_digest");
    return AccountRecord.builder()
        .id(rs.getString("id"))
        .email(rs.getString("email"))
        .username(rs.getString("username"))
        .passwordHash(rs.getString("password_hash"))
        .externalIdentity(
            provider == null ? null : new ExternalIdentity(provider, rs.getString("auth_provider_id")))
        .emailVerified(rs.getBoolean("email_verified"))
        .verificationToken(
            verificationDigest == null
                ? null
                : new SingleUseTokenSlot(
                    verificationDigest, getInstant(rs, "verification_token_expires_at")))
        .passwordResetToken(
            resetDigest == null
                ? null
                : new SingleUseTokenSlot(resetDigest, getInstant(rs, "password_reset_token_expires_at")))
        .profile(
            new AccountProfile(
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("nickname"),
                rs.getString("phone"),
                rs.getString("avatar_url"),
                rs.getString("bio")))
        .role(AccountRole.valueOf(rs.getString("role")))
        .status(AccountStatus.valueOf(rs.getString("status")))
        .active(rs.getBoolean("is_active"))
        .lastLoginAt(getInstant(rs, "last_login_at"))
        .lastLoginAddress(rs.getString("last_login_address"))
        .createdAt(getInstant(rs, "created_at"))
        .updatedAt(getInstant(rs, "updated_at"))
        .deletedAt(getInstant(rs, "deleted_at"))
        .version(rs.getLong("version"))
        .build();
  }
}
