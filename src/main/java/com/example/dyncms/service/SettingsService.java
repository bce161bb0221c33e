package com.example.dyncms.service;

import com.example.dyncms.access.SettingAccess;
import com.example.dyncms.config.WorkflowProperties;
import com.example.dyncms.models.Setting;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * System settings. Only the {@code permissions} setting is interpreted here; its
 * {@code contentApproval} flag gates publishing by non-administrators.
 */
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final SettingAccess settingAccess;
    private final WorkflowProperties workflowProperties;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public boolean isContentApprovalRequired() {
        return settingAccess.findByKey(Setting.PERMISSIONS)
                .map(Setting::getValue)
                .map(value -> value.get(Setting.CONTENT_APPROVAL))
                .filter(JsonNode::isBoolean)
                .map(JsonNode::booleanValue)
                .orElse(workflowProperties.isContentApproval());
    }

    public boolean updateContentApproval(boolean contentApproval, CallerIdentity caller) {
        if (!caller.isPrivileged()) {
            throw CmsException.forbidden("Only administrators can change permissions");
        }
        ObjectNode value = settingAccess.findByKey(Setting.PERMISSIONS)
                .map(Setting::getValue)
                .filter(JsonNode::isObject)
                .map(existing -> (ObjectNode) existing.deepCopy())
                .orElseGet(JsonNodeFactory.instance::objectNode);
        value.put(Setting.CONTENT_APPROVAL, contentApproval);

        settingAccess.save(Setting.builder()
                .key(Setting.PERMISSIONS)
                .value(value)
                .updatedAt(clock.millis())
                .build());
        activityLogService.recordSettingUpdated(caller, Setting.PERMISSIONS,
                Map.of(Setting.CONTENT_APPROVAL, contentApproval));
        return contentApproval;
    }
}
