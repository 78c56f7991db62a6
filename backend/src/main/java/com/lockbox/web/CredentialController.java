package com.lockbox.web;

import static com.lockbox.web.VaultController.blocking;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.lockbox.service.VaultService;
import com.lockbox.vault.CredentialRecord;
import com.lockbox.web.VaultRequests.CredentialRequest;
import com.lockbox.web.VaultRequests.SearchRequest;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/credentials")
public class CredentialController {

    private final VaultService vaultService;

    public CredentialController(VaultService vaultService) {
        this.vaultService = vaultService;
    }

    @GetMapping
    public Mono<List<CredentialRecord>> list(@RequestHeader("Authorization") String authorization) {
        return blocking(() -> vaultService.listCredentials(AuthorizationHeader.sessionId(authorization)));
    }

    @GetMapping("/{id}")
    public Mono<CredentialRecord> get(@RequestHeader("Authorization") String authorization,
                                      @PathVariable String id) {
        return blocking(() -> vaultService.getCredential(AuthorizationHeader.sessionId(authorization), id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CredentialRecord> add(@RequestHeader("Authorization") String authorization,
                                      @RequestBody CredentialRequest request) {
        return blocking(() -> vaultService.addCredential(AuthorizationHeader.sessionId(authorization), request.toFields()));
    }

    @PutMapping("/{id}")
    public Mono<CredentialRecord> update(@RequestHeader("Authorization") String authorization,
                                         @PathVariable String id,
                                         @RequestBody CredentialRequest request) {
        return blocking(() -> vaultService.updateCredential(AuthorizationHeader.sessionId(authorization), id, request.toFields()));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@RequestHeader("Authorization") String authorization,
                             @PathVariable String id) {
        return blocking(() -> {
            vaultService.deleteCredential(AuthorizationHeader.sessionId(authorization), id);
            return true;
        }).then();
    }

    @PostMapping("/search")
    public Mono<List<CredentialRecord>> search(@RequestHeader("Authorization") String authorization,
                                               @RequestBody SearchRequest request) {
        return blocking(() -> vaultService.search(AuthorizationHeader.sessionId(authorization), request.query(), request.tags()));
    }
}
