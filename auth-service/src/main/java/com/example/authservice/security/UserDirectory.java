package com.example.authservice.security;

import java.util.Optional;

/**
 * Lookup of the authoritative user record. Implementations must not mutate the store.
 *
 * Implementations translate store timeouts and connectivity failures into Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy.
 */
public interface UserDirectory {

    Optional<UserRecord> findById(String subjectId);
}
