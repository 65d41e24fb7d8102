/*
 * どこで: app/identity/src/main/java/com/example/identity/repository/AccountStore.java
 * 何を: Identity コアが永続化層に要求する契約
 * なぜ: 一意制約・楽観ロック・タイムアウトの扱いを実装差し替え後も同じにするため
 */
package com.example.identity.repository;

import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountSearchCriteria;
import com.example.identity.model.AccountStatistics;
import com.example.identity.model.SingleUseTokenPurpose;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable account storage.
 *
 * <p>Every call is bounded by the store's query timeout. Timeouts and connectivity failures are
 * reported as {@link com.example.identity.service.InfrastructureException}; absence is a normal
 * {@link Optional#empty()} return.
 */
public interface AccountStore {

  /**
   * Inserts a new account ({@code version == 0}) or updates an existing one when its version still
   * matches the stored row. Last-login fields are owned by {@link #recordLogin} and are only written
   * on insert.
   *
   * @return the stored row with its new version
   * @throws UniqueConstraintViolationException if email, username, external identity or a token
   *     digest collides with another row
   * @throws StaleAccountException if the row was updated since it was read
   */
  AccountRecord save(AccountRecord account);

  Optional<AccountRecord> findById(String id);

  /** Prefers the live account; falls back to the most recently soft-deleted one. */
  Optional<AccountRecord> findByEmail(String email);

  /** Live accounts only. */
  Optional<AccountRecord> findByUsername(String username);

  Optional<AccountRecord> findByExternalIdentity(String provider, String providerId);

  /** Looks up a live account by the digest stored in the slot for {@code purpose}. */
  Optional<AccountRecord> findBySingleUseToken(String digest, SingleUseTokenPurpose purpose);

  boolean existsByEmail(String email, boolean excludeDeleted);

  boolean existsByUsername(String username, boolean excludeDeleted);

  /**
   * Records a successful login on an ACTIVE account.
   *
   * @return false if the account is no longer ACTIVE
   */
  boolean recordLogin(String id, Instant at, String originAddress);

  List<AccountRecord> search(AccountSearchCriteria criteria);

  long count(AccountSearchCriteria criteria);

  AccountStatistics statistics();

  /** Irreversibly removes the row. */
  boolean hardDelete(String id);
}
