package com.example.authservice.repository;

import com.example.authservice.entity.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for AuditLog entity. Rows are only ever inserted.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
}
