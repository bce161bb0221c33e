package com.example.dyncms.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

public record EntryPageResponse(
        @JsonProperty("entries") List<ObjectNode> entries,
        @JsonProperty("totalCount") int totalCount,
        @JsonProperty("page") int page,
        @JsonProperty("limit") int limit,
        @JsonProperty("pages") int pages
) {
}
