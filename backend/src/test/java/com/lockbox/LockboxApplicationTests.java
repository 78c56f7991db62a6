package com.lockbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.lockbox.web.VaultRequests.SessionResponse;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Full stack over HTTP against a vault file in a temp directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class LockboxApplicationTests {

    private static final Path DATA_DIR = tempDir();

    @DynamicPropertySource
    static void lockboxProperties(DynamicPropertyRegistry registry) {
        registry.add("lockbox.vault.path", () -> DATA_DIR.resolve("vault.lbx").toString());
    }

    @Autowired
    private WebTestClient webTestClient;

    private static Path tempDir() {
        try {
            return Files.createTempDirectory("lockbox-app");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void createUnlockStoreAndLogout() {
        webTestClient.post().uri("/api/vault/create")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("passphrase", "Tr0ub4dor&3"))
                .exchange()
                .expectStatus().isCreated();

        SessionResponse session = webTestClient.post().uri("/api/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("passphrase", "Tr0ub4dor&3"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(SessionResponse.class)
                .returnResult()
                .getResponseBody();
        assertNotNull(session);
        String bearer = "Bearer " + session.sessionId();

        webTestClient.post().uri("/api/credentials")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("serviceName", "github", "username", "alice", "secret", "s3cr3t"))
                .exchange()
                .expectStatus().isCreated();

        webTestClient.post().uri("/api/credentials/search")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "GIT"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].secret").isEqualTo("s3cr3t");

        webTestClient.get().uri("/api/audit-logs/verify")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.verifiedEntries").isEqualTo(4);

        webTestClient.post().uri("/api/auth/logout")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .exchange()
                .expectStatus().isOk();

        webTestClient.get().uri("/api/credentials")
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .exchange()
                .expectStatus().isUnauthorized();

        assertTrue(Files.exists(DATA_DIR.resolve("vault.lbx.audit")), "Audit log sits next to the vault");
    }
}
