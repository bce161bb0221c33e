package com.example.dyncms.http;

import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentTypeResponse(
        @JsonProperty("apiId") String apiId,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("fields") List<FieldDefinition> fields,
        @JsonProperty("fieldCount") int fieldCount,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("updatedAt") String updatedAt
) {
    static ContentTypeResponse from(ContentTypeDefinition definition) {
        return new ContentTypeResponse(
                definition.getApiId(),
                definition.getDisplayName(),
                definition.getDescription(),
                definition.getFields(),
                definition.getFields().size(),
                Instant.ofEpochMilli(definition.getCreatedAt()).toString(),
                Instant.ofEpochMilli(definition.getUpdatedAt()).toString()
        );
    }
}
