package com.poufmaker.api.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    CLIENT("client"),
    UPHOLSTERER("upholsterer"),
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canPlaceBids() {
        return switch (this) {
            case UPHOLSTERER -> true;
            case CLIENT, ADMIN -> false;
        };
    }

    public boolean canSelfRegister() {
        return switch (this) {
            case CLIENT, UPHOLSTERER -> true;
            case ADMIN -> false;
        };
    }

    public boolean isAdministrator() {
        return switch (this) {
            case ADMIN -> true;
            case CLIENT, UPHOLSTERER -> false;
        };
    }

    public String authority() {
        return "ROLE_" + name();
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        for (UserRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
