package com.lockbox.web;

import static com.lockbox.web.VaultController.blocking;

import java.time.Duration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.lockbox.service.VaultService;
import com.lockbox.share.IssuedShare;
import com.lockbox.share.SharedCredential;
import com.lockbox.web.VaultRequests.RedeemRequest;
import com.lockbox.web.VaultRequests.ShareRequest;
import com.lockbox.web.VaultRequests.ShareResponse;

import reactor.core.publisher.Mono;

/**
 * Issuing needs a session; redeeming is done by the recipient and only needs the token.
 */
@RestController
@RequestMapping("/api/share")
public class ShareController {

    private final VaultService vaultService;

    public ShareController(VaultService vaultService) {
        this.vaultService = vaultService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ShareResponse> issue(@RequestHeader("Authorization") String authorization,
                                     @RequestBody ShareRequest request) {
        return blocking(() -> {
            Duration ttl = request.ttlSeconds() == null ? null : Duration.ofSeconds(request.ttlSeconds());
            char[] passphrase = Passphrases.toChars(request.sharePassphrase());
            try {
                IssuedShare share = vaultService.issueShare(
                        AuthorizationHeader.sessionId(authorization), request.credentialId(), ttl, passphrase);
                return new ShareResponse(share.token(), share.tokenId(), share.expiresAt(), share.passphraseProtected());
            } finally {
                Passphrases.wipe(passphrase);
            }
        });
    }

    @PostMapping("/{token}/redeem")
    public Mono<SharedCredential> redeem(@PathVariable String token,
                                         @RequestBody(required = false) RedeemRequest request) {
        return blocking(() -> {
            char[] passphrase = request == null ? null : Passphrases.toChars(request.sharePassphrase());
            try {
                return vaultService.redeemShare(token, passphrase);
            } finally {
                Passphrases.wipe(passphrase);
            }
        });
    }
}
