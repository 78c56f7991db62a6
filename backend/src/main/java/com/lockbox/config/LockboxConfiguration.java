package com.lockbox.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.lockbox.audit.AuditLog;
import com.lockbox.audit.AuditProps;
import com.lockbox.crypto.CipherCodec;
import com.lockbox.crypto.KeyDerivation;
import com.lockbox.crypto.PasswordGenerator;
import com.lockbox.session.AuthSessionManager;
import com.lockbox.session.SessionProps;
import com.lockbox.share.ShareProps;
import com.lockbox.share.ShareTokenService;
import com.lockbox.support.StorageMapper;
import com.lockbox.vault.VaultProps;
import com.lockbox.vault.VaultStore;

/**
 * Wires the engine. The engine classes are plain objects; only this class knows
 * about Spring. The storage ObjectMapper is not a bean, so the web
 * layer keeps Boot's own mapper.
 */
@Configuration
public class LockboxConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyDerivation keyDerivation() {
        return new KeyDerivation();
    }

    @Bean
    public CipherCodec cipherCodec() {
        return new CipherCodec();
    }

    @Bean
    public PasswordGenerator passwordGenerator() {
        return new PasswordGenerator();
    }

    @Bean
    public AuditLog auditLog(VaultProps vaultProps, AuditProps auditProps, Clock clock) {
        String path = auditProps.path() == null || auditProps.path().isBlank()
                ? vaultProps.path() + ".audit"
                : auditProps.path();
        return new AuditLog(Path.of(path), StorageMapper.create(), clock);
    }

    @Bean
    public VaultStore vaultStore(VaultProps props,
                                 KeyDerivation keyDerivation,
                                 CipherCodec cipherCodec,
                                 AuditLog auditLog,
                                 Clock clock) {
        return new VaultStore(Path.of(props.path()), props.kdfIterations(), keyDerivation, cipherCodec,
                auditLog, StorageMapper.create(), clock);
    }

    @Bean(destroyMethod = "endAll")
    public AuthSessionManager authSessionManager(SessionProps props, AuditLog auditLog, Clock clock) {
        return new AuthSessionManager(props, auditLog, clock);
    }

    @Bean
    public ShareTokenService shareTokenService(ShareProps props,
                                               CipherCodec cipherCodec,
                                               KeyDerivation keyDerivation,
                                               AuditLog auditLog,
                                               Clock clock) {
        return new ShareTokenService(props, cipherCodec, keyDerivation, auditLog, StorageMapper.create(), clock);
    }
}
