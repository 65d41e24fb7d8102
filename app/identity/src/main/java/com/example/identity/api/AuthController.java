/*
 * どこで: app/identity/src/main/java/com/example/identity/api/AuthController.java
 * 何を: 登録・ログイン・トークン更新・メール確認・パスワードリセットの API
 * なぜ: 未認証で呼ばれる経路をひとつのコントローラーへまとめ、Security 設定の許可範囲を明確にするため
 */
package com.example.identity.api;

import com.example.identity.api.request.ExternalLoginRequest;
import com.example.identity.api.request.LoginRequest;
import com.example.identity.api.request.PasswordResetConfirmRequest;
import com.example.identity.api.request.PasswordResetRequest;
import com.example.identity.api.request.RefreshRequest;
import com.example.identity.api.request.RegisterRequest;
import com.example.identity.api.request.VerifyEmailRequest;
import com.example.identity.api.response.AcknowledgedResponse;
import com.example.identity.api.response.AuthResponse;
import com.example.identity.api.response.ExistsResponse;
import com.example.identity.api.response.ExternalLoginResponse;
import com.example.identity.api.response.RegistrationResponse;
import com.example.identity.api.response.SuccessResponse;
import com.example.identity.api.response.VerifyEmailResponse;
import com.example.identity.config.ClientAddressResolver;
import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.service.AccountService;
import com.example.identity.service.AuthenticationService;
import com.example.identity.service.ExternalLoginCommand;
import com.example.identity.service.RegisterCommand;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final AccountService accountService;

    public AuthController(AuthenticationService authenticationService, AccountService accountService) {
        this.authenticationService = authenticationService;
        this.accountService = accountService;
    }

    /**
     * 役割:
     * - パスワードでアカウントを作成する。
     *
     * 期待動作:
     * - 作成直後は PENDING。確認トークンは通知経由でのみ届け、応答には含めない。
     * - email/username 重複は 409 とする。
     */
    @PostMapping("/register")
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegisterRequest request) {
        final RegisterCommand command =
                new RegisterCommand(
                        request.email(),
                        request.username(),
                        request.password(),
                        null,
                        null,
                        new AccountProfile(
                                request.firstName(), request.lastName(), request.nickname(), null, null, null));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RegistrationResponse.from(authenticationService.register(command)));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(
            @Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(
                AuthResponse.from(
                        authenticationService.login(
                                request.email(),
                                request.password(),
                                ClientAddressResolver.resolve(httpRequest))));
    }

    /**
     * 役割:
     * - ゲートウェイが検証済みの外部 IdP 主張でログインする。
     *
     * 期待動作:
     * - 初回は ACTIVE のアカウントを作成し newAccount=true を返す。
     * - 同時初回ログインでも作成されるのは 1 件のみで、残りは newAccount=false となる。
     */
    @PostMapping("/external-login")
    public ResponseEntity<ExternalLoginResponse> externalLogin(
            @Valid @RequestBody ExternalLoginRequest request, HttpServletRequest httpRequest) {
        final ExternalLoginCommand command =
                new ExternalLoginCommand(
                        request.provider(),
                        request.providerId(),
                        request.email(),
                        request.username(),
                        new AccountProfile(
                                request.firstName(),
                                request.lastName(),
                                request.nickname(),
                                null,
                                request.avatarUrl(),
                                null),
                        ClientAddressResolver.resolve(httpRequest));
        return ResponseEntity.ok(
                ExternalLoginResponse.from(authenticationService.externalLogin(command)));
    }

    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(AuthResponse.from(authenticationService.refresh(request.refreshToken())));
    }

    @PostMapping("/verify-email")
    public ResponseEntity<VerifyEmailResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        final AccountRecord account = authenticationService.verifyEmail(request.token());
        return ResponseEntity.ok(new VerifyEmailResponse(account.emailVerified(), account.status().name()));
    }

    /**
     * 役割:
     * - パスワードリセット用トークンの発行を依頼する。
     *
     * 期待動作:
     * - email の存在有無に関わらず常に同じ応答を返す。
     */
    @PostMapping("/password-reset")
    public ResponseEntity<AcknowledgedResponse> requestPasswordReset(
            @RequestBody PasswordResetRequest request) {
        authenticationService.requestPasswordReset(request.email());
        return ResponseEntity.accepted().body(AcknowledgedResponse.ACKNOWLEDGED);
    }

    @PostMapping("/password-reset:confirm")
    public ResponseEntity<SuccessResponse> confirmPasswordReset(
            @Valid @RequestBody PasswordResetConfirmRequest request) {
        authenticationService.confirmPasswordReset(request.token(), request.newPassword());
        return ResponseEntity.ok(SuccessResponse.OK);
    }

    @GetMapping("/email-exists")
    public ResponseEntity<ExistsResponse> emailExists(@RequestParam("email") String email) {
        return ResponseEntity.ok(new ExistsResponse(accountService.checkEmailExists(email)));
    }

    @GetMapping("/username-exists")
    public ResponseEntity<ExistsResponse> usernameExists(@RequestParam("username") String username) {
        return ResponseEntity.ok(new ExistsResponse(accountService.checkUsernameExists(username)));
    }
}
