package com.example.dyncms.requests;

import java.util.Objects;

/**
 * Listing query. {@code sort} is an attribute name, prefixed with {@code -} for descending order;
 * a null limit means the configured default.
 */
public record ListEntriesServiceRequest(
        String apiId,
        int page,
        Integer limit,
        String search,
        String sort
) {

    public static final String DEFAULT_SORT = "-createdAt";

    public ListEntriesServiceRequest {
        Objects.requireNonNull(apiId, "apiId");
        page = Math.max(page, 1);
        search = search == null || search.isBlank() ? null : search.trim();
        sort = sort == null || sort.isBlank() ? DEFAULT_SORT : sort.trim();
    }
}
