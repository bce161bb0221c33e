package com.example.dyncms.requests;

import com.example.dyncms.service.CallerIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

public record UpdateEntryServiceRequest(
        String apiId,
        String entryId,
        ObjectNode payload,
        CallerIdentity caller
) {

    public UpdateEntryServiceRequest(String apiId, String entryId, JsonNode payload, CallerIdentity caller) {
        this(apiId, entryId, CreateEntryServiceRequest.asObject(payload), caller);
    }

    public UpdateEntryServiceRequest {
        Objects.requireNonNull(apiId, "apiId");
        if (apiId.isBlank()) {
            throw new IllegalArgumentException("apiId must be non-blank");
        }
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(caller, "caller");
    }
}
