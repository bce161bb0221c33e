package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Closed vocabulary of field kinds a content type may declare. Each kind maps to exactly one
 * {@link StoragePrimitive}; the wire name is the lowercase token used in definitions.
 */
public enum FieldType {
    TEXT("text", StoragePrimitive.STRING),
    RICHTEXT("richtext", StoragePrimitive.STRING),
    EMAIL("email", StoragePrimitive.STRING),
    PASSWORD("password", StoragePrimitive.STRING),
    ENUM("enum", StoragePrimitive.STRING),
    NUMBER("number", StoragePrimitive.NUMBER),
    BOOLEAN("boolean", StoragePrimitive.BOOLEAN),
    DATE("date", StoragePrimitive.TIMESTAMP),
    DATETIME("datetime", StoragePrimitive.TIMESTAMP),
    JSON("json", StoragePrimitive.STRUCTURED),
    MEDIA("media", StoragePrimitive.REFERENCE),
    RELATION("relation", StoragePrimitive.REFERENCE);

    private final String wireName;
    private final StoragePrimitive primitive;

    FieldType(String wireName, StoragePrimitive primitive) {
        this.wireName = wireName;
        this.primitive = primitive;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public StoragePrimitive primitive() {
        return primitive;
    }

    public boolean isReference() {
        return primitive == StoragePrimitive.REFERENCE;
    }

    /** Free-text search covers string fields, except passwords. */
    public boolean isSearchable() {
        return primitive == StoragePrimitive.STRING && this != PASSWORD;
    }

    @JsonCreator
    public static FieldType fromString(String v) {
        if (v != null) {
            String normalized = v.trim().toLowerCase(Locale.ROOT);
            for (FieldType t : values()) {
                if (t.wireName.equals(normalized)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + v);
    }
}
