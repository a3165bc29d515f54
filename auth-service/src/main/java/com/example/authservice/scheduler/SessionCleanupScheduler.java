package com.example.authservice.scheduler;

import com.example.authservice.security.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Scheduled job to delete expired session families and refresh tokens.
 *
 * Revoked families are kept until they expire so that a reused token from them is still
 * recognized and rejected as revoked rather than unknown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionCleanupScheduler {

    private final SessionStore sessionStore;
    private final Clock clock;

    /**
     * Cron: auth.session.cleanup-cron (default daily at 3 AM).
     */
    @Scheduled(cron = "${auth.session.cleanup-cron:0 0 3 * * *}")
    public void cleanupExpiredSessions() {
        Instant cutoff = clock.instant();
        log.info("Starting cleanup job for sessions expired before {}", cutoff);

        int deleted = sessionStore.deleteExpired(cutoff);

        if (deleted > 0) {
            log.info("Deleted {} expired sessions", deleted);
        } else {
            log.debug("No expired sessions to clean up");
        }
    }
}
