package com.example.dyncms.service;

import java.util.Objects;

/**
 * Authenticated caller as asserted by the upstream gateway.
 */
public record CallerIdentity(String userId, Role role) {

    public CallerIdentity {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must be non-blank");
        }
        role = role == null ? Role.VIEWER : role;
    }

    public boolean isPrivileged() {
        return role.isPrivileged();
    }

    public boolean canAuthor() {
        return role.canAuthor();
    }

    /** Whether the caller may modify an entry created by {@code creatorId}. */
    public boolean mayModify(String creatorId) {
        return canAuthor() && (isPrivileged() || userId.equals(creatorId));
    }
}
