package com.example.authservice.security;

import com.example.authservice.exception.ResolverException;
import com.example.authservice.exception.ResolverException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Binds a verified token to the current user record.
 *
 * The stored record is authoritative: a token whose role no longer matches the stored role
 * is rejected, so a demoted user cannot keep using an older, more privileged token.
 * Organization scope and activation state are taken from the record, not the token.
 */
@Slf4j
public class IdentityResolver {

    private final UserDirectory userDirectory;
    private final SessionStore sessionStore;

    public IdentityResolver(UserDirectory userDirectory, SessionStore sessionStore) {
        this.userDirectory = userDirectory;
        this.sessionStore = sessionStore;
    }

    /**
     * @throws ResolverException USER_NOT_FOUND, USER_DISABLED, ROLE_MISMATCH, SESSION_REVOKED or TRANSIENT
     */
    public Identity resolve(Identity fromToken) {
        return resolve(fromToken, false);
    }

    /**
     * @param allowRevokedSession skip the session check, for routes that act on the session itself
     */
    public Identity resolve(Identity fromToken, boolean allowRevokedSession) {
        try {
            UserRecord user = userDirectory.findById(fromToken.subjectId())
                    .orElseThrow(() -> new ResolverException(Reason.USER_NOT_FOUND, fromToken.subjectId()));

            if (user.disabled()) {
                throw new ResolverException(Reason.USER_DISABLED, fromToken.subjectId());
            }
            if (user.role() != fromToken.role()) {
                throw new ResolverException(Reason.ROLE_MISMATCH,
                        "token role " + fromToken.role() + ", stored role " + user.role());
            }
            // Tokens without a session (service accounts) are bounded by their expiry only
            if (!allowRevokedSession && fromToken.sessionId() != null
                    && sessionStore.isRevoked(fromToken.sessionId())) {
                throw new ResolverException(Reason.SESSION_REVOKED, fromToken.sessionId());
            }

            return fromToken.withStoredState(user.role(), user.organizationId(), user.active());

        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            log.error("User store unavailable while resolving subject {}", fromToken.subjectId(), e);
            throw new ResolverException(Reason.TRANSIENT, e.getClass().getSimpleName(), e);
        }
    }
}
