package com.example.dyncms.access;

import com.example.dyncms.models.ContentTypeDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code content_types} table.
 */
public interface ContentTypeAccess {

    Optional<ContentTypeDefinition> findByApiId(String apiId);

    List<ContentTypeDefinition> findAll();

    /**
     * Creates a new definition. Fails with
     * {@link software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException}
     * if the apiId is already taken.
     */
    ContentTypeDefinition save(ContentTypeDefinition definition);

    /**
     * Replaces an existing definition in place.
     */
    ContentTypeDefinition update(ContentTypeDefinition definition);

    void delete(String apiId);
}
