package com.example.dyncms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Paging limits for list endpoints (content.listing.*).
 */
@Component
@ConfigurationProperties(prefix = "content.listing")
@Data
public class ListingProperties {

    private int defaultLimit = 10;
    private int maxLimit = 100;

    public int clampLimit(Integer requested) {
        if (requested == null || requested < 1) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }
}
