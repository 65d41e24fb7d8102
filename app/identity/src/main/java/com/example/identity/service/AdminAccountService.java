/*
 * どこで: app/identity/src/main/java/com/example/identity/service/AdminAccountService.java
 * 何を: 管理者による状態遷移・ロール変更・削除と監査ログ記録
 * なぜ: 管理操作と監査ログを同一トランザクションで確定させ、追跡不能な変更を残さないため
 */
package com.example.identity.service;

import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AuditLogRecord;
import com.example.identity.model.LifecycleEvent;
import com.example.identity.repository.AccountStore;
import com.example.identity.repository.AuditLogRepository;
import com.example.identity.repository.StaleAccountException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AdminAccountService {

  private static final Logger logger = LoggerFactory.getLogger(AdminAccountService.class);

  private final AccountStore accountStore;
  private final AuditLogRepository auditLogRepository;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  /** Includes soft-deleted accounts. */
  public AccountRecord getAccount(String accountId) {
    return accountStore
        .findById(accountId)
        .orElseThrow(() -> IdentityException.notFound("account not found"));
  }

  @Transactional
  public AccountRecord suspend(String actorAccountId, String targetAccountId, String reason) {
    return transition(actorAccountId, targetAccountId, LifecycleEvent.SUSPEND, reason);
  }

  @Transactional
  public AccountRecord activate(String actorAccountId, String targetAccountId) {
    return transition(actorAccountId, targetAccountId, LifecycleEvent.ACTIVATE, null);
  }

  @Transactional
  public AccountRecord deactivate(String actorAccountId, String targetAccountId) {
    return transition(actorAccountId, targetAccountId, LifecycleEvent.DEACTIVATE, null);
  }

  @Transactional
  public AccountRecord softDelete(String actorAccountId, String targetAccountId, String reason) {
    return transition(actorAccountId, targetAccountId, LifecycleEvent.SOFT_DELETE, reason);
  }

  @Transactional
  public AccountRecord promote(String actorAccountId, String targetAccountId) {
    return changeRole(actorAccountId, targetAccountId, AccountRole.ADMIN, "PROMOTE_ACCOUNT");
  }

  @Transactional
  public AccountRecord demote(String actorAccountId, String targetAccountId) {
    return changeRole(actorAccountId, targetAccountId, AccountRole.USER, "DEMOTE_ACCOUNT");
  }

  /** Irreversible. Bypasses the lifecycle table, including for DELETED accounts. */
  @Transactional
  public void hardDelete(String actorAccountId, String targetAccountId) {
    requireIds(actorAccountId, targetAccountId);
    final AccountRecord account = getAccount(targetAccountId);
    if (!accountStore.hardDelete(targetAccountId)) {
      throw IdentityException.notFound("account not found");
    }
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("email", account.email());
    metadata.put("from_status", account.status().name());
    audit(actorAccountId, "HARD_DELETE_ACCOUNT", targetAccountId, metadata);
    logger.warn("account hard deleted accountId={} actor={}", targetAccountId, actorAccountId);
  }

  private AccountRecord transition(
      String actorAccountId, String targetAccountId, LifecycleEvent event, String reason) {
    requireIds(actorAccountId, targetAccountId);
    final AccountRecord account = getAccount(targetAccountId);
    final AccountRecord updated =
        save(AccountLifecycle.apply(account, event, clock.instant()));

    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("from_status", account.status().name());
    metadata.put("to_status", updated.status().name());
    if (reason != null) {
      metadata.put("reason", reason);
    }
    audit(actorAccountId, event.name() + "_ACCOUNT", targetAccountId, metadata);
    logger.info(
        "account {} accountId={} actor={} from={} to={}",
        event,
        targetAccountId,
        actorAccountId,
        account.status(),
        updated.status());
    return updated;
  }

  private AccountRecord changeRole(
      String actorAccountId, String targetAccountId, AccountRole role, String action) {
    requireIds(actorAccountId, targetAccountId);
    final AccountRecord account = getAccount(targetAccountId);
    final AccountRecord updated =
        save(AccountLifecycle.changeRole(account, role, clock.instant()));

    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("from_role", account.role().name());
    metadata.put("to_role", role.name());
    audit(actorAccountId, action, targetAccountId, metadata);
    logger.info(
        "account role changed accountId={} actor={} role={}", targetAccountId, actorAccountId, role);
    return updated;
  }

  private AccountRecord save(AccountRecord account) {
    try {
      return accountStore.save(account);
    } catch (StaleAccountException ex) {
      throw IdentityException.conflict("account was modified concurrently, retry");
    }
  }

  private void requireIds(String actorAccountId, String targetAccountId) {
    if (actorAccountId == null || actorAccountId.isBlank()) {
      throw IdentityException.validation("actor_account_id is required");
    }
    if (targetAccountId == null || targetAccountId.isBlank()) {
      throw IdentityException.validation("target_account_id is required");
    }
  }

  private void audit(
      String actorAccountId, String action, String targetAccountId, Map<String, Object> metadata) {
    auditLogRepository.insert(
        new AuditLogRecord(
            UUID.randomUUID().toString(),
            actorAccountId,
            action,
            targetAccountId,
            createMetadataJson(metadata),
            Instant.now(clock)));
  }

  private String createMetadataJson(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit metadata", e);
    }
  }
}
