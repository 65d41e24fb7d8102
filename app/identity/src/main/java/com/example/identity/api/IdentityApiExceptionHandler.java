/*
 * どこで: app/identity/src/main/java/com/example/identity/api/IdentityApiExceptionHandler.java
 * 何を: Identity API の例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、呼び出し側の分岐を ErrorKind だけで済ませるため
 */
package com.example.identity.api;

import com.example.identity.service.DigestCorruptException;
import com.example.identity.service.ErrorKind;
import com.example.identity.service.IdentityException;
import com.example.identity.service.InfrastructureException;
import com.google.common.annotations.VisibleForTesting;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class IdentityApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(IdentityApiExceptionHandler.class);

    @ExceptionHandler(IdentityException.class)
    public ResponseEntity<ApiErrorResponse> handleIdentity(IdentityException ex) {
        final HttpStatus status = statusOf(ex.kind());
        if (ex instanceof InfrastructureException infrastructure) {
            logger.warn("identity infrastructure failure reason={}", infrastructure.reason(), ex);
        }
        return ResponseEntity.status(status)
                .body(new ApiErrorResponse(ex.kind().name(), ex.getMessage(), ex.kind().isRetryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        final String message =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(error -> error.getField() + " " + error.getDefaultMessage())
                        .sorted()
                        .collect(Collectors.joining(", "));
        return validation(message.isEmpty() ? "request is invalid" : message);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception ex) {
        return validation("request is malformed");
    }

    /**
     * 役割:
     * - 保存済みダイジェストの破損を 500 として返す。
     *
     * 期待動作:
     * - 詳細は応答へ含めず、ログにのみ残す。
     */
    @ExceptionHandler(DigestCorruptException.class)
    public ResponseEntity<ApiErrorResponse> handleDigestCorrupt(DigestCorruptException ex) {
        logger.error("stored password digest is unreadable", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", "internal error", false));
    }

    private ResponseEntity<ApiErrorResponse> validation(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse(ErrorKind.VALIDATION.name(), message, false));
    }

    @VisibleForTesting
    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, NO_PASSWORD_SET -> HttpStatus.BAD_REQUEST;
            case CONFLICT, ILLEGAL_TRANSITION -> HttpStatus.CONFLICT;
            case INVALID_CREDENTIALS, TOKEN_EXPIRED, TOKEN_INVALID -> HttpStatus.UNAUTHORIZED;
            case ACCOUNT_INACTIVE -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
