package com.example.dyncms.service;

import com.example.dyncms.models.EntryIds;
import com.example.dyncms.schema.CompiledField;
import com.example.dyncms.schema.CompiledModel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Cleans relation and media values the admin UI sends before they are validated. Placeholder
 * values are dropped instead of rejected, so this never fails; whatever survives is still
 * checked by the codec.
 */
@Component
public class ReferenceNormalizer {

    private static final Set<String> PLACEHOLDERS = Set.of("", "null", "undefined");

    /**
     * Returns a normalized copy of {@code payload}. Non-reference fields are copied untouched.
     */
    public ObjectNode normalize(CompiledModel model, ObjectNode payload) {
        ObjectNode result = payload.deepCopy();
        for (CompiledField field : model.referenceFields()) {
            if (!result.has(field.name())) {
                continue;
            }
            JsonNode cleaned = clean(result.get(field.name()));
            if (cleaned == null) {
                result.remove(field.name());
            } else {
                result.set(field.name(), cleaned);
            }
        }
        return result;
    }

    private JsonNode clean(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isArray()) {
            return cleanList((ArrayNode) value);
        }
        JsonNode scalar = unwrap(value);
        if (!scalar.isTextual()) {
            return null;
        }
        String id = scalar.textValue().trim().toLowerCase(Locale.ROOT);
        return EntryIds.isValid(id) ? TextNode.valueOf(id) : null;
    }

    private JsonNode cleanList(ArrayNode values) {
        ArrayNode kept = values.arrayNode();
        for (JsonNode element : values) {
            if (element == null || element.isNull()) {
                continue;
            }
            JsonNode item = unwrap(element);
            if (item.isNull()) {
                continue;
            }
            if (item.isTextual()) {
                String id = item.textValue().trim();
                if (PLACEHOLDERS.contains(id)) {
                    continue;
                }
                String lowered = id.toLowerCase(Locale.ROOT);
                if (EntryIds.looksLikeId(lowered) && !EntryIds.isValid(lowered)) {
                    continue;
                }
                kept.add(EntryIds.isValid(lowered) ? lowered : id);
            } else {
                kept.add(item);
            }
        }
        return kept.isEmpty() ? null : kept;
    }

    // Populated references arrive as { "id": ..., ... } objects.
    private JsonNode unwrap(JsonNode value) {
        if (value.isObject() && value.has("id")) {
            return value.get("id");
        }
        return value;
    }
}
