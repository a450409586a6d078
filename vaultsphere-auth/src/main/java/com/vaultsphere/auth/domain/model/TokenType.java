package com.vaultsphere.auth.domain.model;

public enum TokenType {
    MFA_PENDING("MFA_PENDING"),
    ACCESS("ACCESS");

    private final String value;

    TokenType(String val) {
        this.value = val;
    }

    @Override
    public String toString() {
        return this.value;
    }

    public static TokenType fromValue(String val) {
        for (TokenType tokenType : TokenType.values()) {
            if (tokenType.toString().equals(val)) {
                return tokenType;
            }
        }
        return null;
    }
}
