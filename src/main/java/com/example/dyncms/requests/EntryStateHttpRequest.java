package com.example.dyncms.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record EntryStateHttpRequest(
        @NotBlank @JsonProperty("state") String state
) {
}
