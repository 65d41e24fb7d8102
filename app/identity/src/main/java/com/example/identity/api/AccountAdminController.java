/*
 * どこで: app/identity/src/main/java/com/example/identity/api/AccountAdminController.java
 * 何を: 管理者向けアカウント操作 API を提供
 * なぜ: 高権限操作を明示的な経路に分離するため
 */
package com.example.identity.api;

import com.example.identity.api.response.AccountPageResponse;
import com.example.identity.api.response.AccountResponse;
import com.example.identity.api.response.AccountStatisticsResponse;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AccountSearchCriteria;
import com.example.identity.model.AccountStatus;
import com.example.identity.service.AccountService;
import com.example.identity.service.AdminAccountService;
import java.security.Principal;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/accounts")
public class AccountAdminController {

    private final AdminAccountService adminAccountService;
    private final AccountService accountService;

    public AccountAdminController(
            AdminAccountService adminAccountService, AccountService accountService) {
        this.adminAccountService = adminAccountService;
        this.accountService = accountService;
    }

    @GetMapping
    public ResponseEntity<AccountPageResponse> listAccounts(
            @RequestParam(value = "q", required = false) String searchTerm,
            @RequestParam(value = "role", required = false) AccountRole role,
            @RequestParam(value = "status", required = false) AccountStatus status,
            @RequestParam(value = "provider", required = false) String provider,
            @RequestParam(value = "emailVerified", required = false) Boolean emailVerified,
            @RequestParam(value = "active", required = false) Boolean active,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        final AccountSearchCriteria criteria =
                new AccountSearchCriteria(
                        searchTerm, role, status, provider, emailVerified, active, offset, limit);
        return ResponseEntity.ok(AccountPageResponse.from(accountService.listAccounts(criteria)));
    }

    @GetMapping("/statistics")
    public ResponseEntity<AccountStatisticsResponse> statistics() {
        return ResponseEntity.ok(AccountStatisticsResponse.from(accountService.statistics()));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(AccountResponse.from(adminAccountService.getAccount(accountId)));
    }

    /**
     * 役割:
     * - 対象アカウントを停止し、監査ログへ操作記録を残す。
     *
     * 期待動作:
     * - 操作者はアクセストークンの subject から取得する。
     * - 呼び出し権限の判定は Security 設定側で実施し、本メソッドは業務処理に専念する。
     */
    @PostMapping("/{accountId}:suspend")
    public ResponseEntity<AccountResponse> suspend(
            @PathVariable("accountId") String accountId,
            @RequestParam(value = "reason", required = false) String reason,
            Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(adminAccountService.suspend(principal.getName(), accountId, reason)));
    }

    @PostMapping("/{accountId}:activate")
    public ResponseEntity<AccountResponse> activate(
            @PathVariable("accountId") String accountId, Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(adminAccountService.activate(principal.getName(), accountId)));
    }

    @PostMapping("/{accountId}:deactivate")
    public ResponseEntity<AccountResponse> deactivate(
            @PathVariable("accountId") String accountId, Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(adminAccountService.deactivate(principal.getName(), accountId)));
    }

    @PostMapping("/{accountId}:promote")
    public ResponseEntity<AccountResponse> promote(
            @PathVariable("accountId") String accountId, Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(adminAccountService.promote(principal.getName(), accountId)));
    }

    @PostMapping("/{accountId}:demote")
    public ResponseEntity<AccountResponse> demote(
            @PathVariable("accountId") String accountId, Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(adminAccountService.demote(principal.getName(), accountId)));
    }

    @PostMapping("/{accountId}:delete")
    public ResponseEntity<AccountResponse> softDelete(
            @PathVariable("accountId") String accountId,
            @RequestParam(value = "reason", required = false) String reason,
            Principal principal) {
        return ResponseEntity.ok(
                AccountResponse.from(
                        adminAccountService.softDelete(principal.getName(), accountId, reason)));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> hardDelete(
            @PathVariable("accountId") String accountId, Principal principal) {
        adminAccountService.hardDelete(principal.getName(), accountId);
        return ResponseEntity.noContent().build();
    }
}
