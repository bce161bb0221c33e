package com.example.dyncms.access;

import com.example.dyncms.models.ContentEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
@Slf4j
public class DynamoContentEntryAccess implements ContentEntryAccess {

    static final String TABLE = "content_entries";

    private final DynamoDbTable<ContentEntry> table;

    public DynamoContentEntryAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(ContentEntry.class));
    }

    @Override
    public Optional<ContentEntry> findById(String apiId, String entryId) {
        return Optional.ofNullable(table.getItem(r -> r.key(buildKey(apiId, entryId)).consistentRead(true)));
    }

    @Override
    public List<ContentEntry> findAllByApiId(String apiId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(apiId).build()))
                        .consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasEntries(String apiId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(apiId).build()))
                        .limit(1))
                .items()
                .stream()
                .findFirst()
                .isPresent();
    }

    @Override
    public ContentEntry save(ContentEntry entry) {
        table.putItem(entry);
        return entry;
    }

    @Override
    public boolean delete(String apiId, String entryId) {
        return table.deleteItem(buildKey(apiId, entryId)) != null;
    }

    @Override
    public int deleteAllByApiId(String apiId) {
        List<ContentEntry> entries = findAllByApiId(apiId);
        for (ContentEntry entry : entries) {
            table.deleteItem(buildKey(entry.getApiId(), entry.getEntryId()));
        }
        log.debug("Deleted {} entries of content type {}", entries.size(), apiId);
        return entries.size();
    }

    private Key buildKey(String apiId, String entryId) {
        return Key.builder()
                .partitionValue(apiId)
                .sortValue(entryId)
                .build();
    }
}
