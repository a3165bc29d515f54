package com.example.authservice.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Audit Log entity for authentication and authorization events.
 *
 * Rows are immutable: never updated or deleted by the service.
 * detail holds the internal reason that is not returned to the caller.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_subject", columnList = "subject_id"),
    @Index(name = "idx_audit_action", columnList = "action"),
    @Index(name = "idx_audit_created_at", columnList = "created_at")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Subject the event is about (NULL when the email did not match any account)
    @Column(name = "subject_id", length = 36)
    private String subjectId;

    @Column(name = "actor_email", length = 255)
    private String actorEmail;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private AuditOutcome outcome = AuditOutcome.SUCCESS;

    @Column(length = 500)
    private String detail;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum AuditOutcome {
        SUCCESS,
        FAILURE,
        DENIED
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.subjectId = builder.subjectId;
        this.actorEmail = builder.actorEmail;
        this.action = builder.action;
        this.outcome = builder.outcome;
        this.detail = builder.detail;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String subjectId;
        private String actorEmail;
        private AuditAction action;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;
        private String detail;
        private String ipAddress;
        private String userAgent;

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder actorEmail(String actorEmail) {
            this.actorEmail = actorEmail;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    // Getters only (immutable)
    public Long getId() { return id; }
    public String getSubjectId() { return subjectId; }
    public String getActorEmail() { return actorEmail; }
    public AuditAction getAction() { return action; }
    public AuditOutcome getOutcome() { return outcome; }
    public String getDetail() { return detail; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public Instant getCreatedAt() { return createdAt; }
}
