package com.example.authservice.service;

import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.AuditLog.AuditOutcome;
import com.example.authservice.entity.User;
import com.example.authservice.repository.AuditLogRepository;
import com.example.authservice.security.CorrelationIdFilter;
import com.example.authservice.security.DenyReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for creating audit logs.
 *
 * Design Decisions:
 * 1. @Async: audit writes never slow down login or refresh
 * 2. REQUIRES_NEW: rows survive a rollback of the calling transaction
 * 3. Graceful degradation: a failed write is logged and dropped
 * 4. Request context (client IP, user agent) comes from MDC, which MdcTaskDecorator
 *    copies onto the worker thread
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private static final int MAX_DETAIL_LENGTH = 500;
    private static final int MAX_IP_LENGTH = 45;

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    // ==================== Authentication Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginSuccess(User user) {
        createAuditLog(user.getId(), user.getEmail(), AuditAction.LOGIN_SUCCESS, AuditOutcome.SUCCESS, null);
    }

    /**
     * Unknown email or wrong password. subjectId is null when the email matched no account.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginFailure(String subjectId, String email, String reason) {
        createAuditLog(subjectId, email, AuditAction.LOGIN_FAILED, AuditOutcome.FAILURE, reason);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginDenied(User user, String reason) {
        createAuditLog(user.getId(), user.getEmail(), AuditAction.LOGIN_DENIED, AuditOutcome.DENIED, reason);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLogout(String subjectId, String sessionId) {
        createAuditLog(subjectId, null, AuditAction.LOGOUT, AuditOutcome.SUCCESS, "session " + sessionId);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLogoutAll(String subjectId, int revokedSessions) {
        createAuditLog(subjectId, null, AuditAction.LOGOUT_ALL, AuditOutcome.SUCCESS,
                revokedSessions + " sessions revoked");
    }

    // ==================== Refresh Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRefreshSuccess(String subjectId) {
        createAuditLog(subjectId, null, AuditAction.REFRESH_SUCCESS, AuditOutcome.SUCCESS, null);
    }

    /**
     * Security event: a rotated refresh token was presented again.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRefreshReuse(String subjectId, String familyId) {
        createAuditLog(subjectId, null, AuditAction.REFRESH_REUSE, AuditOutcome.DENIED,
                "Refresh token reuse detected - session " + familyId + " revoked");
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRefreshExpired(String subjectId) {
        createAuditLog(subjectId, null, AuditAction.REFRESH_EXPIRED, AuditOutcome.FAILURE, null);
    }

    // ==================== Account Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordChange(User user, int revokedSessions) {
        createAuditLog(user.getId(), user.getEmail(), AuditAction.PASSWORD_CHANGE, AuditOutcome.SUCCESS,
                revokedSessions + " sessions revoked");
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAdminBootstrap(User admin) {
        createAuditLog(admin.getId(), admin.getEmail(), AuditAction.ADMIN_BOOTSTRAP, AuditOutcome.SUCCESS, null);
    }

    // ==================== Authorization Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAccessDenied(String subjectId, String routeId, DenyReason reason) {
        createAuditLog(subjectId, null, AuditAction.ACCESS_DENIED, AuditOutcome.DENIED, reason + " on " + routeId);
    }

    // ==================== Internal ====================

    private void createAuditLog(String subjectId, String actorEmail, AuditAction action,
                                AuditOutcome outcome, String detail) {
        try {
            AuditLog auditLog = AuditLog.builder()
                    .subjectId(subjectId)
                    .actorEmail(actorEmail)
                    .action(action)
                    .outcome(outcome)
                    .detail(truncate(detail, MAX_DETAIL_LENGTH))
                    .ipAddress(truncate(MDC.get(CorrelationIdFilter.MDC_CLIENT_IP), MAX_IP_LENGTH))
                    .userAgent(truncate(MDC.get(CorrelationIdFilter.MDC_USER_AGENT), MAX_DETAIL_LENGTH))
                    .build();

            auditLogRepository.save(auditLog);

            log.debug("Audit log created: {} {} for subject {}", action, outcome, subjectId);

        } catch (Exception e) {
            // Graceful degradation: log error but don't fail the main operation
            log.error("Failed to create audit log: {} {} for subject {}", action, outcome, subjectId, e);
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
