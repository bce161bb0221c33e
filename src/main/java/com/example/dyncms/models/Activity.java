package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * One entry of the activity feed. {@code entityType} is {@code content_type} for schema changes,
 * {@code setting} for settings and the content type's apiId for entry mutations.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Activity {

    public static final String CONTENT_TYPE_ENTITY = "content_type";
    public static final String SETTING_ENTITY = "setting";

    @NonNull private String activityId;  // PK
    @NonNull private String userId;
    @NonNull private ActivityAction action;
    @NonNull private String entityType;
    @NonNull private Long createdAt;

    // Optional fields
    private String entityId;
    private String requestId;
    private Map<String, Object> details;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("activity_id")
    public String getActivityId() { return activityId; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("action")
    public ActivityAction getAction() { return action; }

    @DynamoDbAttribute("entity_type")
    public String getEntityType() { return entityType; }

    @DynamoDbAttribute("entity_id")
    public String getEntityId() { return entityId; }

    @DynamoDbAttribute("request_id")
    public String getRequestId() { return requestId; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("details")
    public Map<String, Object> getDetails() { return details; }
}
