package com.vaultsphere.auth.domain.model;

/**
 * Terminal states of the login state machine.
 * SUCCESS and MFA_REQUIRED carry a token; the rest are credential failures.
 */
public enum LoginOutcome {
    SUCCESS,
    MFA_REQUIRED,
    INVALID_CREDENTIALS,
    ACCOUNT_LOCKED,
    INVALID_MFA_CODE
}
