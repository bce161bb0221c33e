package com.example.dyncms.access;

import com.example.dyncms.models.ContentTypeDefinition;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoContentTypeAccess implements ContentTypeAccess {

    static final String TABLE = "content_types";

    private final DynamoDbTable<ContentTypeDefinition> table;

    public DynamoContentTypeAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(ContentTypeDefinition.class));
    }

    @Override
    public Optional<ContentTypeDefinition> findByApiId(String apiId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(apiId)).consistentRead(true)));
    }

    @Override
    public List<ContentTypeDefinition> findAll() {
        return table.scan()
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public ContentTypeDefinition save(ContentTypeDefinition definition) {
        table.putItem(r -> r.item(definition)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(api_id)")
                        .build()));
        return definition;
    }

    @Override
    public ContentTypeDefinition update(ContentTypeDefinition definition) {
        table.putItem(definition);
        return definition;
    }

    @Override
    public void delete(String apiId) {
        table.deleteItem(buildKey(apiId));
    }

    private Key buildKey(String apiId) {
        return Key.builder().partitionValue(apiId).build();
    }
}
