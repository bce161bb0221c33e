package com.example.dyncms.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ContentTypeDeletionResponse(
        @JsonProperty("apiId") String apiId,
        @JsonProperty("entriesDeleted") int entriesDeleted
) {
}
