package com.example.dyncms.access;

import com.example.dyncms.models.Activity;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoActivityAccess implements ActivityAccess {

    static final String TABLE = "activities";

    private final DynamoDbTable<Activity> table;

    public DynamoActivityAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE, TableSchema.fromBean(Activity.class));
    }

    @Override
    public void put(Activity activity) {
        table.putItem(activity);
    }

    @Override
    public List<Activity> findRecent(int limit) {
        // The table has no time-ordered key, so the feed is sorted after a scan.
        return table.scan()
                .items()
                .stream()
                .sorted(Comparator.comparing(Activity::getCreatedAt).reversed()
                        .thenComparing(Activity::getActivityId))
                .limit(limit)
                .toList();
    }
}
