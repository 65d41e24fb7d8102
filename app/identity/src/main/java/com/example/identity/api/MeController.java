/*
 * どこで: app/identity/src/main/java/com/example/identity/api/MeController.java
 * 何を: 認証済み本人のアカウント参照・更新 API
 * なぜ: 対象 ID をパスで受け取らず、アクセストークンの subject だけを信頼するため
 */
package com.example.identity.api;

import com.example.identity.api.request.ChangePasswordRequest;
import com.example.identity.api.request.ProfilePatchRequest;
import com.example.identity.api.response.AccountResponse;
import com.example.identity.api.response.AcknowledgedResponse;
import com.example.identity.api.response.SuccessResponse;
import com.example.identity.service.AccountService;
import com.example.identity.service.AuthenticationService;
import jakarta.validation.Valid;
import java.security.Principal;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/me")
public class MeController {

    private final AccountService accountService;
    private final AuthenticationService authenticationService;

    public MeController(AccountService accountService, AuthenticationService authenticationService) {
        this.accountService = accountService;
        this.authenticationService = authenticationService;
    }

    @GetMapping
    public ResponseEntity<AccountResponse> getMe(Principal principal) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(principal.getName())));
    }

    /**
     * 役割:
     * - プロフィール・email・username を更新する。
     *
     * 期待動作:
     * - email を変更した場合は未確認へ戻し、新しい確認トークンを通知する。
     */
    @PatchMapping
    public ResponseEntity<AccountResponse> patchMe(
            Principal principal, @Valid @RequestBody ProfilePatchRequest request) {
        return ResponseEntity.ok(
                AccountResponse.from(
                        accountService.updateProfile(principal.getName(), request.toProfileUpdate())));
    }

    @PostMapping("/password")
    public ResponseEntity<SuccessResponse> changePassword(
            Principal principal, @Valid @RequestBody ChangePasswordRequest request) {
        authenticationService.changePassword(
                principal.getName(), request.currentPassword(), request.newPassword());
        return ResponseEntity.ok(SuccessResponse.OK);
    }

    @PostMapping("/email-verification")
    public ResponseEntity<AcknowledgedResponse> resendEmailVerification(Principal principal) {
        authenticationService.resendEmailVerification(principal.getName());
        return ResponseEntity.accepted().body(AcknowledgedResponse.ACKNOWLEDGED);
    }
}
