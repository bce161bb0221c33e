package com.example.dyncms.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PermissionsResponse(
        @JsonProperty("contentApproval") boolean contentApproval
) {
}
