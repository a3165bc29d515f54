package com.example.authservice.service;

import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.AuditLog.AuditOutcome;
import com.example.authservice.repository.AuditLogRepository;
import com.example.authservice.security.CorrelationIdFilter;
import com.example.authservice.security.DenyReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditServiceTest {

    private AuditLogRepository repository;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        repository = mock(AuditLogRepository.class);
        auditService = new AuditService(repository);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void accessDeniedRowCarriesRouteReasonAndClientContext() {
        MDC.put(CorrelationIdFilter.MDC_CLIENT_IP, "203.0.113.9");
        MDC.put(CorrelationIdFilter.MDC_USER_AGENT, "pragati-web/1.0");

        auditService.logAccessDenied("user-1", "* /api/coordinator/**", DenyReason.INSUFFICIENT_ROLE);

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(repository).save(saved.capture());
        AuditLog row = saved.getValue();
        assertEquals("user-1", row.getSubjectId());
        assertEquals(AuditAction.ACCESS_DENIED, row.getAction());
        assertEquals(AuditOutcome.DENIED, row.getOutcome());
        assertEquals("INSUFFICIENT_ROLE on * /api/coordinator/**", row.getDetail());
        assertEquals("203.0.113.9", row.getIpAddress());
        assertEquals("pragati-web/1.0", row.getUserAgent());
    }

    @Test
    void anonymousLoginFailureHasNoSubject() {
        auditService.logLoginFailure(null, "ghost@college.edu", "User not found");

        ArgumentCaptor<AuditLog> saved = ArgumentCaptor.forClass(AuditLog.class);
        verify(repository).save(saved.capture());
        assertNull(saved.getValue().getSubjectId());
        assertEquals("ghost@college.edu", saved.getValue().getActorEmail());
        assertEquals(AuditOutcome.FAILURE, saved.getValue().getOutcome());
    }

    @Test
    void storeFailureDoesNotPropagate() {
        when(repository.save(any(AuditLog.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> auditService.logRefreshReuse("user-1", "family-1"));
    }
}
