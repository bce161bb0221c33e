package com.example.dyncms.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * One field of a content type as submitted by the admin UI. The type stays a raw string here so
 * an unknown type is reported as an invalid definition rather than a malformed body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldHttpRequest(
        @JsonProperty("name") String name,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("type") String type,
        @JsonProperty("required") Boolean required,
        @JsonProperty("unique") Boolean unique,
        @JsonProperty("defaultValue") JsonNode defaultValue,
        @JsonProperty("options") List<String> options,
        @JsonProperty("relationTo") String relationTo,
        @JsonProperty("relationMany") Boolean relationMany,
        @JsonProperty("multiple") Boolean multiple
) {
}
