package com.example.dyncms.access;

import com.example.dyncms.models.Setting;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoSettingAccess implements SettingAccess {

    static final String TABLE = "settings";

    private final DynamoDbTable<Setting> table;

    public DynamoSettingAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(Setting.class));
    }

    @Override
    public Optional<Setting> findByKey(String key) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder().partitionValue(key).build())
                .consistentRead(true)));
    }

    @Override
    public Setting save(Setting setting) {
        table.putItem(setting);
        return setting;
    }
}
