package com.lockbox.web;

import java.util.Base64;
import java.util.List;
import java.util.concurrent.Callable;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.lockbox.audit.AuditLogEntry;
import com.lockbox.crypto.PasswordGenerator;
import com.lockbox.service.AuthStatus;
import com.lockbox.service.VaultService;
import com.lockbox.service.VaultStats;
import com.lockbox.session.AuthSession;
import com.lockbox.vault.VaultHeader;
import com.lockbox.web.VaultRequests.ChangePassphraseRequest;
import com.lockbox.web.VaultRequests.ExistsResponse;
import com.lockbox.web.VaultRequests.ExportRequest;
import com.lockbox.web.VaultRequests.ExportResponse;
import com.lockbox.web.VaultRequests.ImportRequest;
import com.lockbox.web.VaultRequests.ImportResponse;
import com.lockbox.web.VaultRequests.IntegrityResponse;
import com.lockbox.web.VaultRequests.PassphraseRequest;
import com.lockbox.web.VaultRequests.PasswordRequest;
import com.lockbox.web.VaultRequests.PasswordResponse;
import com.lockbox.web.VaultRequests.SessionResponse;
import com.lockbox.web.VaultRequests.VerifyResponse;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Vault lifecycle, authentication, audit and password tools.
 * Session ids travel in {@code Authorization: Bearer <session_id>}.
 */
@RestController
@RequestMapping("/api")
public class VaultController {

    private final VaultService vaultService;

    public VaultController(VaultService vaultService) {
        this.vaultService = vaultService;
    }

    @GetMapping("/vault/exists")
    public Mono<ExistsResponse> exists() {
        return blocking(() -> new ExistsResponse(vaultService.vaultExists()));
    }

    @PostMapping("/vault/create")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Void> create(@RequestBody PassphraseRequest request) {
        return blocking(() -> {
            char[] passphrase = Passphrases.toChars(request.passphrase());
            try {
                vaultService.createVault(passphrase);
            } finally {
                Passphrases.wipe(passphrase);
            }
            return true;
        }).then();
    }

    @PostMapping("/auth/login")
    public Mono<SessionResponse> login(@RequestBody PassphraseRequest request) {
        return blocking(() -> {
            char[] passphrase = Passphrases.toChars(request.passphrase());
            try {
                AuthSession session = vaultService.authenticate(passphrase);
                return new SessionResponse(session.sessionId(), session.createdAt());
            } finally {
                Passphrases.wipe(passphrase);
            }
        });
    }

    @PostMapping("/auth/logout")
    public Mono<Void> logout(@RequestHeader("Authorization") String authorization) {
        return blocking(() -> {
            vaultService.logout(AuthorizationHeader.sessionId(authorization));
            return true;
        }).then();
    }

    @GetMapping("/auth/status")
    public Mono<AuthStatus> status(@RequestHeader(value = "Authorization", required = false) String authorization) {
        return blocking(() -> vaultService.authStatus(AuthorizationHeader.sessionId(authorization)));
    }

    @PostMapping("/vault/passphrase")
    public Mono<Void> changePassphrase(@RequestHeader("Authorization") String authorization,
                                       @RequestBody ChangePassphraseRequest request) {
        return blocking(() -> {
            char[] oldPassphrase = Passphrases.toChars(request.oldPassphrase());
            char[] newPassphrase = Passphrases.toChars(request.newPassphrase());
            try {
                vaultService.changePassphrase(AuthorizationHeader.sessionId(authorization), oldPassphrase, newPassphrase);
            } finally {
                Passphrases.wipe(oldPassphrase, newPassphrase);
            }
            return true;
        }).then();
    }

    @PostMapping("/vault/export")
    public Mono<ExportResponse> export(@RequestHeader("Authorization") String authorization,
                                       @RequestBody ExportRequest request) {
        return blocking(() -> {
            char[] passphrase = Passphrases.toChars(request.exportPassphrase());
            try {
                byte[] bundle = vaultService.exportVault(AuthorizationHeader.sessionId(authorization), passphrase);
                return new ExportResponse(Base64.getEncoder().encodeToString(bundle));
            } finally {
                Passphrases.wipe(passphrase);
            }
        });
    }

    @PostMapping("/vault/import")
    public Mono<ImportResponse> importBundle(@RequestHeader("Authorization") String authorization,
                                             @RequestBody ImportRequest request) {
        return blocking(() -> {
            if (request.bundle() == null) {
                throw new IllegalArgumentException("bundle is required");
            }
            byte[] bundle = Base64.getDecoder().decode(request.bundle());
            char[] passphrase = Passphrases.toChars(request.exportPassphrase());
            try {
                return new ImportResponse(
                        vaultService.importVault(AuthorizationHeader.sessionId(authorization), bundle, passphrase));
            } finally {
                Passphrases.wipe(passphrase);
            }
        });
    }

    @GetMapping("/vault/stats")
    public Mono<VaultStats> stats(@RequestHeader("Authorization") String authorization) {
        return blocking(() -> vaultService.vaultStats(AuthorizationHeader.sessionId(authorization)));
    }

    @GetMapping("/vault/integrity")
    public Mono<IntegrityResponse> integrity() {
        return blocking(() -> {
            VaultHeader header = vaultService.checkIntegrity();
            return new IntegrityResponse(header.formatVersion(), header.kdfIterations());
        });
    }

    @GetMapping("/audit-logs")
    public Mono<List<AuditLogEntry>> auditLogs(@RequestHeader("Authorization") String authorization,
                                               @RequestParam(defaultValue = "100") int limit) {
        return blocking(() -> vaultService.readAuditLog(AuthorizationHeader.sessionId(authorization), limit));
    }

    @GetMapping("/audit-logs/verify")
    public Mono<VerifyResponse> verifyAuditLog(@RequestHeader("Authorization") String authorization) {
        return blocking(() -> new VerifyResponse(vaultService.verifyAuditLog(AuthorizationHeader.sessionId(authorization))));
    }

    @PostMapping("/password/generate")
    public Mono<PasswordResponse> generatePassword(@RequestBody PasswordRequest request) {
        return blocking(() -> {
            PasswordGenerator.Options defaults = PasswordGenerator.Options.defaults();
            PasswordGenerator.Options options = new PasswordGenerator.Options(
                    request.length() != null ? request.length() : defaults.length(),
                    request.uppercase() != null ? request.uppercase() : defaults.uppercase(),
                    request.lowercase() != null ? request.lowercase() : defaults.lowercase(),
                    request.digits() != null ? request.digits() : defaults.digits(),
                    request.symbols() != null ? request.symbols() : defaults.symbols(),
                    request.excludeAmbiguous() != null ? request.excludeAmbiguous() : defaults.excludeAmbiguous());
            String password = vaultService.generatePassword(options);
            PasswordGenerator.Strength strength = vaultService.estimateStrength(password);
            return new PasswordResponse(password, strength.rating(), strength.entropyBits());
        });
    }

    static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
