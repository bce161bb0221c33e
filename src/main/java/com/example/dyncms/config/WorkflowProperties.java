package com.example.dyncms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Publishing workflow defaults bound from application.yml (content.workflow.*).
 * {@code contentApproval} only applies until the permissions setting has been saved.
 */
@Component
@ConfigurationProperties(prefix = "content.workflow")
@Data
public class WorkflowProperties {

    private boolean contentApproval = false;
}
