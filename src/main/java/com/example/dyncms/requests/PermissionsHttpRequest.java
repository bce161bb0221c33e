package com.example.dyncms.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record PermissionsHttpRequest(
        @NotNull @JsonProperty("contentApproval") Boolean contentApproval
) {
}
