package com.example.dyncms.config;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the service's tables when {@code server.aws.create-tables=true}. Meant for LocalStack
 * and local development; real deployments provision tables separately.
 */
@Component
@ConditionalOnProperty(prefix = "server.aws", name = "create-tables", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DynamoTableInitializer {

    private final DynamoDbClient dynamo;

    public void createTables() {
        createTable("content_types", "api_id", null);
        createTable("content_entries", "api_id", "entry_id");
        createTable("activities", "activity_id", null);
        createTable("settings", "setting_key", null);
        createTable("media", "media_id", null);
    }

    private void createTable(String name, String partitionKey, String sortKey) {
        List<AttributeDefinition> attributes = sortKey == null
                ? List.of(stringAttribute(partitionKey))
                : List.of(stringAttribute(partitionKey), stringAttribute(sortKey));
        List<KeySchemaElement> keys = sortKey == null
                ? List.of(key(partitionKey, KeyType.HASH))
                : List.of(key(partitionKey, KeyType.HASH), key(sortKey, KeyType.RANGE));
        try {
            dynamo.createTable(CreateTableRequest.builder()
                    .tableName(name)
                    .attributeDefinitions(attributes)
                    .keySchema(keys)
                    .billingMode(BillingMode.PAY_PER_REQUEST)
                    .build());
            dynamo.waiter().waitUntilTableExists(r -> r.tableName(name));
            log.info("Created table {}", name);
        } catch (ResourceInUseException ex) {
            log.debug("Table {} already exists", name);
        }
    }

    private static AttributeDefinition stringAttribute(String name) {
        return AttributeDefinition.builder()
                .attributeName(name)
                .attributeType(ScalarAttributeType.S)
                .build();
    }

    private static KeySchemaElement key(String name, KeyType type) {
        return KeySchemaElement.builder().attributeName(name).keyType(type).build();
    }
}
