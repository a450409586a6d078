package com.vaultsphere.auth.domain.model;

public enum SecurityEventType {
    USER_REGISTERED,
    LOGIN_SUCCESS,
    LOGIN_MFA_CHALLENGE,
    LOGIN_FAILED_UNKNOWN_EMAIL,
    LOGIN_FAILED_INVALID_PASSWORD,
    LOGIN_FAILED_INVALID_MFA,
    LOGIN_BLOCKED_ACCOUNT_LOCKED,
    ACCOUNT_LOCKED,
    MFA_SETUP_STARTED,
    MFA_ENABLED,
    MFA_ENABLE_FAILED,
    MFA_DISABLED,
    MFA_DISABLE_FAILED
}
