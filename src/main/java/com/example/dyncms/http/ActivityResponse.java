package com.example.dyncms.http;

import com.example.dyncms.models.Activity;
import com.example.dyncms.models.ActivityAction;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityResponse(
        @JsonProperty("id") String id,
        @JsonProperty("userId") String userId,
        @JsonProperty("action") ActivityAction action,
        @JsonProperty("entityType") String entityType,
        @JsonProperty("entityId") String entityId,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("requestId") String requestId,
        @JsonProperty("createdAt") String createdAt
) {
    static ActivityResponse from(Activity activity) {
        return new ActivityResponse(
                activity.getActivityId(),
                activity.getUserId(),
                activity.getAction(),
                activity.getEntityType(),
                activity.getEntityId(),
                activity.getDetails(),
                activity.getRequestId(),
                Instant.ofEpochMilli(activity.getCreatedAt()).toString()
        );
    }
}
