package com.example.dyncms.requests;

import com.example.dyncms.service.CallerIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

public record CreateEntryServiceRequest(
        String apiId,
        ObjectNode payload,
        CallerIdentity caller
) {

    public CreateEntryServiceRequest(String apiId, JsonNode payload, CallerIdentity caller) {
        this(apiId, asObject(payload), caller);
    }

    public CreateEntryServiceRequest {
        Objects.requireNonNull(apiId, "apiId");
        if (apiId.isBlank()) {
            throw new IllegalArgumentException("apiId must be non-blank");
        }
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(caller, "caller");
    }

    static ObjectNode asObject(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        return (ObjectNode) payload;
    }
}
