package com.example.dyncms.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentTypeHttpRequest(
        @JsonProperty("apiId") String apiId,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("fields") List<FieldHttpRequest> fields
) {
}
