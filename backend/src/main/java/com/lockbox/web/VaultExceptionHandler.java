package com.lockbox.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import com.lockbox.error.AuthenticationException;
import com.lockbox.error.IntegrityException;
import com.lockbox.error.LockoutException;
import com.lockbox.error.NotFoundException;
import com.lockbox.error.SessionExpiredException;
import com.lockbox.error.TamperDetectedException;
import com.lockbox.error.TokenExpiredException;
import com.lockbox.error.VaultException;
import com.lockbox.error.VaultExistsException;
import com.lockbox.web.VaultRequests.ErrorResponse;

/**
 * Maps the engine's failure kinds to HTTP statuses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class VaultExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(VaultExceptionHandler.class);

    @ExceptionHandler(VaultException.class)
    public ResponseEntity<ErrorResponse> handleVault(VaultException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed: {} ({})", e.getMessage(), e.code());
        } else {
            log.debug("Request rejected: {} ({})", e.getMessage(), e.code());
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (e instanceof LockoutException lockout && lockout.lockedUntil() != null) {
            response.header(HttpHeaders.RETRY_AFTER, lockout.lockedUntil().toString());
        }
        return response.body(new ErrorResponse(e.code(), e.getMessage()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, ServerWebInputException.class })
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    static HttpStatus statusFor(VaultException e) {
        if (e instanceof AuthenticationException || e instanceof SessionExpiredException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (e instanceof LockoutException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof TokenExpiredException) {
            return HttpStatus.GONE;
        }
        if (e instanceof IntegrityException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof VaultExistsException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof TamperDetectedException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
