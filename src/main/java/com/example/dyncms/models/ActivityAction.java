package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityAction {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    STATE_CHANGE("state_change");

    private final String wireName;

    ActivityAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
