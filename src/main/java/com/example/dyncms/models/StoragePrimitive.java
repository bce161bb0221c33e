package com.example.dyncms.models;

/**
 * Storage shape a field value takes once it is persisted in an entry document.
 */
public enum StoragePrimitive {
    STRING,
    NUMBER,
    BOOLEAN,
    TIMESTAMP,
    STRUCTURED,
    REFERENCE
}
