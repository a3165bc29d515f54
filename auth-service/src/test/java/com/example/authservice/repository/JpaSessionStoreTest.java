package com.example.authservice.repository;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.SessionFamily;
import com.example.authservice.entity.SessionFamily.RevokeReason;
import com.example.authservice.service.JpaSessionStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conditional updates of the session store against a real database.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = "spring.flyway.enabled=false")
@Import(JpaSessionStore.class)
class JpaSessionStoreTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    @Autowired
    private JpaSessionStore sessionStore;

    @Autowired
    private SessionFamilyRepository familyRepository;

    @Autowired
    private RefreshTokenRepository tokenRepository;

    private RefreshToken token(String familyId, Instant expiresAt) {
        String id = UUID.randomUUID().toString();
        return new RefreshToken(id, familyId, "hash-" + id.replace("-", ""), NOW, expiresAt);
    }

    private RefreshToken openFamily(String familyId, String subjectId) {
        RefreshToken first = token(familyId, NOW.plus(Duration.ofDays(7)));
        sessionStore.createFamily(subjectId, first, NOW.plus(Duration.ofDays(7)));
        return first;
    }

    @Test
    void createdFamilyIsLiveAndFindableByTokenHash() {
        RefreshToken first = openFamily("family-a", "user-1");

        assertFalse(sessionStore.isRevoked("family-a"));
        assertEquals("family-a", sessionStore.findTokenByHash(first.getTokenHash()).orElseThrow().getFamilyId());
        assertEquals(first.getId(), sessionStore.findFamily("family-a").orElseThrow().getCurrentTokenId());
    }

    @Test
    void unknownFamilyCountsAsRevoked() {
        assertTrue(sessionStore.isRevoked("no-such-family"));
    }

    @Test
    void rotationSucceedsOnceForTheSameToken() {
        RefreshToken first = openFamily("family-b", "user-1");
        Instant extended = NOW.plus(Duration.ofDays(8));

        RefreshToken second = token("family-b", extended);
        RefreshToken competing = token("family-b", extended);

        assertTrue(sessionStore.rotate("family-b", first, second, extended));
        assertFalse(sessionStore.rotate("family-b", first, competing, extended));

        SessionFamily family = familyRepository.findById("family-b").orElseThrow();
        assertEquals(second.getId(), family.getCurrentTokenId());
        assertEquals(extended, family.getExpiresAt());
        assertTrue(tokenRepository.findById(first.getId()).orElseThrow().isConsumed());
        assertFalse(tokenRepository.findById(second.getId()).orElseThrow().isConsumed());
        assertTrue(tokenRepository.findById(competing.getId()).isEmpty());
        assertEquals(2, tokenRepository.count());
    }

    @Test
    void revokedFamilyCannotRotate() {
        RefreshToken first = openFamily("family-c", "user-1");

        assertTrue(sessionStore.revokeFamily("family-c", RevokeReason.REUSE_DETECTED));

        assertFalse(sessionStore.rotate("family-c", first, token("family-c", NOW.plus(Duration.ofDays(7))),
                NOW.plus(Duration.ofDays(7))));
        assertTrue(sessionStore.isRevoked("family-c"));
    }

    @Test
    void revocationKeepsTheFirstReason() {
        openFamily("family-d", "user-1");

        assertTrue(sessionStore.revokeFamily("family-d", RevokeReason.LOGOUT));
        assertFalse(sessionStore.revokeFamily("family-d", RevokeReason.REUSE_DETECTED));
        assertFalse(sessionStore.revokeFamily("missing", RevokeReason.LOGOUT));

        assertEquals(RevokeReason.LOGOUT, familyRepository.findById("family-d").orElseThrow().getRevokeReason());
    }

    @Test
    void revokeAllAndRevokeOthers() {
        openFamily("family-e1", "user-2");
        openFamily("family-e2", "user-2");
        openFamily("family-e3", "user-2");
        openFamily("family-f1", "user-3");

        assertEquals(2, sessionStore.revokeOtherFamilies("user-2", "family-e3", RevokeReason.SINGLE_SESSION));
        assertTrue(sessionStore.isRevoked("family-e1"));
        assertTrue(sessionStore.isRevoked("family-e2"));
        assertFalse(sessionStore.isRevoked("family-e3"));

        assertEquals(1, sessionStore.revokeAllForSubject("user-2", RevokeReason.LOGOUT_ALL));
        assertTrue(sessionStore.isRevoked("family-e3"));
        assertFalse(sessionStore.isRevoked("family-f1"));
    }

    @Test
    void deleteExpiredRemovesFamiliesAndTheirTokens() {
        RefreshToken stale = token("family-old", NOW.minus(Duration.ofDays(1)));
        sessionStore.createFamily("user-4", stale, NOW.minus(Duration.ofDays(1)));
        RefreshToken live = openFamily("family-live", "user-4");

        assertEquals(1, sessionStore.deleteExpired(NOW));

        assertTrue(familyRepository.findById("family-old").isEmpty());
        assertTrue(tokenRepository.findById(stale.getId()).isEmpty());
        assertTrue(familyRepository.findById("family-live").isPresent());
        assertTrue(tokenRepository.findById(live.getId()).isPresent());
    }
}
