package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.Builder;

/**
 * One declared attribute of a content type, exactly as it is persisted inside the definition.
 * {@code options} only applies to enum fields, {@code relationTo}/{@code relationMany} to relation
 * fields and {@code multiple} to media fields.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("type") FieldType type,
        @JsonProperty("required") boolean required,
        @JsonProperty("unique") boolean unique,
        @JsonProperty("defaultValue") JsonNode defaultValue,
        @JsonProperty("options") List<String> options,
        @JsonProperty("relationTo") String relationTo,
        @JsonProperty("relationMany") boolean relationMany,
        @JsonProperty("multiple") boolean multiple
) {
    public FieldDefinition {
        options = options == null ? null : List.copyOf(options);
    }

    /** Whether this field holds a list of references rather than a single one. */
    public boolean holdsMany() {
        if (type == FieldType.MEDIA) {
            return multiple;
        }
        if (type == FieldType.RELATION) {
            return relationMany;
        }
        return false;
    }
}
