package com.example.dyncms.access;

import com.example.dyncms.models.ContentEntry;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code content_entries} table. Entries of every content type share
 * the table, partitioned by apiId.
 */
public interface ContentEntryAccess {

    Optional<ContentEntry> findById(String apiId, String entryId);

    /**
     * Finds every entry of a content type in storage order. Callers sort and paginate.
     *
     * @param apiId the content type to read
     * @return all entries of the content type
     */
    List<ContentEntry> findAllByApiId(String apiId);

    boolean hasEntries(String apiId);

    ContentEntry save(ContentEntry entry);

    /**
     * Removes one entry.
     *
     * @return whether an entry was actually removed
     */
    boolean delete(String apiId, String entryId);

    /**
     * Removes every entry of a content type. Used when the content type itself is deleted.
     *
     * @return the number of entries removed
     */
    int deleteAllByApiId(String apiId);
}
