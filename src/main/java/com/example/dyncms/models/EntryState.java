package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Publishing lifecycle of a content entry.
 *
 * <pre>
 * DRAFT -> PENDING_APPROVAL -> PUBLISHED
 *   ^                              |
 *   └──────────────────────────────┘
 * </pre>
 */
public enum EntryState {
    DRAFT("draft"),
    PENDING_APPROVAL("pending_approval"),
    PUBLISHED("published");

    private final String wireName;

    EntryState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EntryState fromString(String v) {
        for (EntryState s : values()) {
            if (s.wireName.equals(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown entry state: " + v);
    }
}
