package com.example.dyncms.access;

import com.example.dyncms.models.MediaItem;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoMediaAccess implements MediaAccess {

    static final String TABLE = "media";

    private final DynamoDbTable<MediaItem> table;

    public DynamoMediaAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(MediaItem.class));
    }

    @Override
    public boolean exists(String mediaId) {
        return table.getItem(Key.builder().partitionValue(mediaId).build()) != null;
    }
}
