package com.vaultsphere.auth.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN("admin"),
    CLIENT("client");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String toString() {
        return value;
    }

    @JsonCreator
    public static Role fromValue(String val) {
        for (Role role : Role.values()) {
            if (role.value.equalsIgnoreCase(val)) {
                return role;
            }
        }
        return null;
    }
}
