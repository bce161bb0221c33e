package com.example.dyncms.service;

import java.util.Locale;

public enum Role {
    ADMINISTRATOR("administrator"),
    EDITOR("editor"),
    VIEWER("viewer");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Reads the role header. Missing or unrecognised values fall back to {@link #VIEWER}.
     */
    public static Role fromHeader(String header) {
        if (header == null || header.isBlank()) {
            return VIEWER;
        }
        String normalized = header.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        return VIEWER;
    }

    public boolean isPrivileged() {
        return this == ADMINISTRATOR;
    }

    public boolean canAuthor() {
        return this == ADMINISTRATOR || this == EDITOR;
    }
}
