package com.example.dyncms.requests;

import com.example.dyncms.service.CallerIdentity;
import java.util.Objects;

public record TransitionEntryServiceRequest(
        String apiId,
        String entryId,
        String state,
        CallerIdentity caller
) {

    public TransitionEntryServiceRequest {
        Objects.requireNonNull(apiId, "apiId");
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(caller, "caller");
    }
}
