package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.JsonNode;
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

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class Setting {

    public static final String PERMISSIONS = "permissions";
    public static final String CONTENT_APPROVAL = "contentApproval";

    @NonNull
    private String key;

    @NonNull
    private JsonNode value;

    @NonNull
    private Long updatedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("setting_key")
    public String getKey() { return key; }

    @DynamoDbConvertedBy(JsonNodeAttributeConverter.class)
    @DynamoDbAttribute("value")
    public JsonNode getValue() { return value; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }
}
