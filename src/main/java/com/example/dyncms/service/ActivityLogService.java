package com.example.dyncms.service;

import com.example.dyncms.access.ActivityAccess;
import com.example.dyncms.config.ListingProperties;
import com.example.dyncms.models.Activity;
import com.example.dyncms.models.ActivityAction;
import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.EntryState;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Writes the activity feed. Writes are fire-and-forget: a failing write is logged and never
 * fails the operation that triggered it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityLogService {

    static final String REQUEST_ID_KEY = "requestId";

    private final ActivityAccess activityAccess;
    private final ListingProperties listingProperties;
    private final Clock clock;

    public void recordContentTypeCreated(CallerIdentity caller, ContentTypeDefinition definition) {
        append(caller, ActivityAction.CREATE, Activity.CONTENT_TYPE_ENTITY, definition.getApiId(),
                Map.of("fieldCount", definition.getFields().size()));
    }

    public void recordContentTypeUpdated(CallerIdentity caller, String previousApiId, ContentTypeDefinition definition) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fieldCount", definition.getFields().size());
        if (!previousApiId.equals(definition.getApiId())) {
            details.put("previousApiId", previousApiId);
        }
        append(caller, ActivityAction.UPDATE, Activity.CONTENT_TYPE_ENTITY, definition.getApiId(), details);
    }

    public void recordContentTypeDeleted(CallerIdentity caller, String apiId, int entriesDeleted) {
        append(caller, ActivityAction.DELETE, Activity.CONTENT_TYPE_ENTITY, apiId,
                Map.of("entriesDeleted", entriesDeleted));
    }

    public void recordEntryCreated(CallerIdentity caller, String apiId, String entryId) {
        append(caller, ActivityAction.CREATE, apiId, entryId, null);
    }

    public void recordEntryUpdated(CallerIdentity caller, String apiId, String entryId) {
        append(caller, ActivityAction.UPDATE, apiId, entryId, null);
    }

    public void recordEntryDeleted(CallerIdentity caller, String apiId, String entryId) {
        append(caller, ActivityAction.DELETE, apiId, entryId, null);
    }

    public void recordStateChanged(CallerIdentity caller,
                                   String apiId,
                                   String entryId,
                                   EntryState previousState,
                                   EntryState newState) {
        append(caller, ActivityAction.STATE_CHANGE, apiId, entryId, Map.of(
                "previousState", previousState.wireName(),
                "newState", newState.wireName()));
    }

    public void recordSettingUpdated(CallerIdentity caller, String key, Map<String, Object> details) {
        append(caller, ActivityAction.UPDATE, Activity.SETTING_ENTITY, key, details);
    }

    public List<Activity> recent(Integer limit) {
        return activityAccess.findRecent(listingProperties.clampLimit(limit));
    }

    private void append(CallerIdentity caller,
                        ActivityAction action,
                        String entityType,
                        String entityId,
                        Map<String, Object> details) {
        Activity activity = Activity.builder()
                .activityId(UUID.randomUUID().toString())
                .userId(caller.userId())
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .createdAt(clock.millis())
                .requestId(MDC.get(REQUEST_ID_KEY))
                .details(details)
                .build();
        try {
            activityAccess.put(activity);
        } catch (RuntimeException ex) {
            log.warn("Failed to record {} activity for {} {}", action.wireName(), entityType, entityId, ex);
        }
    }
}
