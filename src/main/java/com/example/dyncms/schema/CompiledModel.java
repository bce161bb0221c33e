package com.example.dyncms.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime model of a content type: ordered fields keyed by name. Holds no entry data. Instances
 * are immutable so a caller holding one sees a consistent field set for its whole operation.
 */
public final class CompiledModel {

    private final String apiId;
    private final List<CompiledField> fields;
    private final Map<String, CompiledField> fieldsByName;
    private final long compiledAt;

    public CompiledModel(String apiId, List<CompiledField> fields, long compiledAt) {
        this.apiId = Objects.requireNonNull(apiId, "apiId");
        this.fields = List.copyOf(fields);
        Map<String, CompiledField> byName = new LinkedHashMap<>();
        for (CompiledField field : this.fields) {
            byName.put(field.name(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.compiledAt = compiledAt;
    }

    public String apiId() {
        return apiId;
    }

    public List<CompiledField> fields() {
        return fields;
    }

    public long compiledAt() {
        return compiledAt;
    }

    public Optional<CompiledField> field(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public boolean hasField(String name) {
        return fieldsByName.containsKey(name);
    }

    public List<CompiledField> referenceFields() {
        return fields.stream().filter(CompiledField::isReference).toList();
    }

    public List<CompiledField> searchableFields() {
        return fields.stream().filter(f -> f.type().isSearchable()).toList();
    }

    @Override
    public String toString() {
        return "CompiledModel[" + apiId + ", fields=" + fieldsByName.keySet() + "]";
    }
}
