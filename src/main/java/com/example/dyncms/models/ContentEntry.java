package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Stored form of one entry of a content type. Declared field values live in {@code data} as a
 * JSON document keyed by field name; absent fields are simply missing from the document.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class ContentEntry {

    // Required fields: Lombok @NonNull enforces null checks in the builder
    @NonNull
    private String apiId;

    @NonNull
    private String entryId;

    @NonNull
    private JsonNode data;

    @NonNull
    @Default
    private EntryState state = EntryState.DRAFT;

    @NonNull
    private String createdBy;

    @NonNull
    private Long createdAt;

    @NonNull
    private Long updatedAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("api_id")
    public String getApiId() { return apiId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("entry_id")
    public String getEntryId() { return entryId; }

    @DynamoDbConvertedBy(JsonNodeAttributeConverter.class)
    @DynamoDbAttribute("data")
    public JsonNode getData() { return data; }

    @DynamoDbAttribute("state")
    public EntryState getState() { return state; }

    @DynamoDbAttribute("created_by")
    public String getCreatedBy() { return createdBy; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }
}
