package com.example.dyncms.requests;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Service-layer command for defining or replacing a content type. Content checks are left to the
 * definition validator so every problem is reported as an invalid definition.
 */
public record PutContentTypeServiceRequest(
        String apiId,
        String displayName,
        String description,
        List<FieldHttpRequest> fields
) {

    public PutContentTypeServiceRequest {
        apiId = apiId == null ? null : apiId.trim();
        displayName = displayName == null ? null : displayName.trim();
        // Element nulls are kept so the validator can point at them.
        fields = fields == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static PutContentTypeServiceRequest from(ContentTypeHttpRequest request, String fallbackApiId) {
        String apiId = request.apiId() == null || request.apiId().isBlank()
                ? fallbackApiId
                : request.apiId();
        return new PutContentTypeServiceRequest(apiId, request.displayName(), request.description(),
                request.fields());
    }
}
