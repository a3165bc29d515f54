package com.example.authservice.service;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.SessionFamily;
import com.example.authservice.entity.SessionFamily.RevokeReason;
import com.example.authservice.repository.RefreshTokenRepository;
import com.example.authservice.repository.SessionFamilyRepository;
import com.example.authservice.security.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * {@link SessionStore} on session_families / refresh_tokens.
 *
 * Every mutation is a conditional UPDATE so two requests racing on the same family cannot
 * both succeed.
 */
@Component
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final SessionFamilyRepository familyRepository;
    private final RefreshTokenRepository tokenRepository;

    @Override
    @Transactional
    public SessionFamily createFamily(String subjectId, RefreshToken firstToken, Instant expiresAt) {
        SessionFamily family = new SessionFamily(
                firstToken.getFamilyId(), subjectId, firstToken.getId(), firstToken.getCreatedAt(), expiresAt);
        family = familyRepository.save(family);
        tokenRepository.save(firstToken);
        return family;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionFamily> findFamily(String familyId) {
        return familyRepository.findById(familyId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findTokenByHash(String tokenHash) {
        return tokenRepository.findByTokenHash(tokenHash);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isRevoked(String familyId) {
        return familyRepository.findRevokedFlag(familyId).orElse(true);
    }

    @Override
    @Transactional
    public boolean revokeFamily(String familyId, RevokeReason reason) {
        return familyRepository.revokeById(familyId, reason) > 0;
    }

    @Override
    @Transactional
    public int revokeAllForSubject(String subjectId, RevokeReason reason) {
        return familyRepository.revokeAllBySubject(subjectId, reason);
    }

    @Override
    @Transactional
    public int revokeOtherFamilies(String subjectId, String keepFamilyId, RevokeReason reason) {
        return familyRepository.revokeAllBySubjectExcept(subjectId, keepFamilyId, reason);
    }

    @Override
    @Transactional
    public boolean rotate(String familyId, RefreshToken presented, RefreshToken next, Instant familyExpiresAt) {
        int updated = familyRepository.compareAndSetCurrentToken(
                familyId, presented.getId(), next.getId(), familyExpiresAt);
        if (updated == 0) {
            return false;
        }
        tokenRepository.markConsumed(presented.getId());
        tokenRepository.save(next);
        return true;
    }

    @Override
    @Transactional
    public int deleteExpired(Instant cutoff) {
        tokenRepository.deleteExpiredBefore(cutoff);
        return familyRepository.deleteExpiredBefore(cutoff);
    }
}
