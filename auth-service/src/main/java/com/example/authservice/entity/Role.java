package com.example.authservice.entity;

/**
 * Platform roles.
 *
 * Stored as STRING in users.role and embedded in the access token "role" claim.
 * The set is closed: switches over Role in the access layer are exhaustive.
 */
public enum Role {
    /**
     * Platform super administrator
     */
    ADMIN,

    /**
     * TTC coordinator - manages innovators and internal mentors of one college
     */
    COORDINATOR,

    /**
     * Principal / college admin - oversees one college
     */
    PRINCIPAL,

    /**
     * Internal or external mentor
     */
    MENTOR,

    /**
     * Student / innovator
     */
    USER,

    /**
     * Internal service caller (notification dispatch, schedulers)
     */
    SERVICE
}
