package com.example.authservice.entity;

/**
 * Audit action types for AuditLog.
 */
public enum AuditAction {
    LOGIN_SUCCESS,    // credentials accepted, session family created
    LOGIN_FAILED,     // unknown email or wrong password
    LOGIN_DENIED,     // correct password, account disabled
    LOGOUT,           // one session family revoked
    LOGOUT_ALL,       // every session family of the subject revoked
    REFRESH_SUCCESS,  // refresh token rotated
    REFRESH_REUSE,    // consumed refresh token presented again (security event)
    REFRESH_EXPIRED,  // refresh token past its expiry
    PASSWORD_CHANGE,  // password changed, all sessions revoked
    ACCESS_DENIED,    // authenticated caller rejected by the access policy
    ADMIN_BOOTSTRAP   // first admin account created
}
