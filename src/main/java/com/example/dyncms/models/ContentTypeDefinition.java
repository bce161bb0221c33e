package com.example.dyncms.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import java.util.Optional;
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
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class ContentTypeDefinition {

    @NonNull
    private String apiId;

    @NonNull
    private String displayName;

    private String description;

    @NonNull
    private List<FieldDefinition> fields;

    @NonNull
    private Long createdAt;

    @NonNull
    private Long updatedAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute("api_id")
    public String getApiId() { return apiId; }

    @DynamoDbAttribute("display_name")
    public String getDisplayName() { return displayName; }

    @DynamoDbAttribute("description")
    public String getDescription() { return description; }

    @DynamoDbConvertedBy(FieldDefinitionListAttributeConverter.class)
    @DynamoDbAttribute("fields")
    public List<FieldDefinition> getFields() { return fields; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    // ----- Domain helpers -----

    public Optional<FieldDefinition> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
