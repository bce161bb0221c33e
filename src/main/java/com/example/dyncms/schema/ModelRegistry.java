package com.example.dyncms.schema;

import com.example.dyncms.service.CmsException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Process-wide registry of compiled models keyed by apiId. Models are immutable and swapped
 * atomically, so concurrent readers never observe a partially updated model.
 */
@Component
public class ModelRegistry {

    private final ConcurrentMap<String, CompiledModel> models = new ConcurrentHashMap<>();

    /**
     * Installs the model for its apiId, replacing any previous one.
     *
     * @return the model that was replaced, if any
     */
    public Optional<CompiledModel> register(CompiledModel model) {
        return Optional.ofNullable(models.put(model.apiId(), model));
    }

    public Optional<CompiledModel> unregister(String apiId) {
        return Optional.ofNullable(models.remove(apiId));
    }

    public Optional<CompiledModel> find(String apiId) {
        return apiId == null ? Optional.empty() : Optional.ofNullable(models.get(apiId));
    }

    /**
     * Returns the current model or fails with a not-found error.
     */
    public CompiledModel require(String apiId) {
        return find(apiId).orElseThrow(() -> CmsException.contentTypeNotFound(apiId));
    }

    public Set<String> apiIds() {
        return new TreeSet<>(models.keySet());
    }

    public int size() {
        return models.size();
    }
}
