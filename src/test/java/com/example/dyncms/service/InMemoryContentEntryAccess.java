package com.example.dyncms.service;

import com.example.dyncms.access.ContentEntryAccess;
import com.example.dyncms.models.ContentEntry;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

class InMemoryContentEntryAccess implements ContentEntryAccess {

    private final ConcurrentHashMap<String, ContentEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ContentEntry> findById(String apiId, String entryId) {
        return Optional.ofNullable(entries.get(key(apiId, entryId)));
    }

    @Override
    public List<ContentEntry> findAllByApiId(String apiId) {
        return entries.values().stream()
                .filter(e -> e.getApiId().equals(apiId))
                .sorted(Comparator.comparing(ContentEntry::getEntryId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean hasEntries(String apiId) {
        return entries.values().stream().anyMatch(e -> e.getApiId().equals(apiId));
    }

    @Override
    public ContentEntry save(ContentEntry entry) {
        entries.put(key(entry.getApiId(), entry.getEntryId()), entry);
        return entry;
    }

    @Override
    public boolean delete(String apiId, String entryId) {
        return entries.remove(key(apiId, entryId)) != null;
    }

    @Override
    public int deleteAllByApiId(String apiId) {
        List<ContentEntry> matching = findAllByApiId(apiId);
        matching.forEach(e -> entries.remove(key(e.getApiId(), e.getEntryId())));
        return matching.size();
    }

    int size() {
        return entries.size();
    }

    private static String key(String apiId, String entryId) {
        return apiId + "#" + entryId;
    }
}
