package com.example.dyncms.schema;

import com.example.dyncms.models.FieldType;
import com.example.dyncms.models.StoragePrimitive;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Storage-level description of one field: its primitive plus the constraints the CRUD engine
 * enforces. Immutable.
 */
public record CompiledField(
        String name,
        FieldType type,
        StoragePrimitive primitive,
        boolean required,
        boolean unique,
        JsonNode defaultValue,
        List<String> options,
        String relationTo,
        boolean many
) {
    public CompiledField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(primitive, "primitive");
        options = options == null ? List.of() : List.copyOf(options);
        defaultValue = defaultValue == null ? null : defaultValue.deepCopy();
    }

    public boolean isReference() {
        return primitive == StoragePrimitive.REFERENCE;
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isNull();
    }
}
