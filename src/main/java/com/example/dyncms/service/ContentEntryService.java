package com.example.dyncms.service;

import com.example.dyncms.access.ContentEntryAccess;
import com.example.dyncms.access.MediaAccess;
import com.example.dyncms.config.ListingProperties;
import com.example.dyncms.models.ContentEntry;
import com.example.dyncms.models.EntryIds;
import com.example.dyncms.models.EntryState;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.models.FieldValue;
import com.example.dyncms.models.FieldValue.BoolValue;
import com.example.dyncms.models.FieldValue.DateValue;
import com.example.dyncms.models.FieldValue.NumberValue;
import com.example.dyncms.models.FieldValue.RefValue;
import com.example.dyncms.models.FieldValue.TextValue;
import com.example.dyncms.requests.CreateEntryServiceRequest;
import com.example.dyncms.requests.ListEntriesServiceRequest;
import com.example.dyncms.requests.TransitionEntryServiceRequest;
import com.example.dyncms.requests.UpdateEntryServiceRequest;
import com.example.dyncms.schema.CompiledField;
import com.example.dyncms.schema.CompiledModel;
import com.example.dyncms.schema.FieldValueCodec;
import com.example.dyncms.schema.ModelRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Generic CRUD over every content type. Each operation works against one snapshot of the
 * compiled model taken from the {@link ModelRegistry}.
 */
@Service
@RequiredArgsConstructor
public class ContentEntryService {

    static final String STATE_KEY = "state";

    private final ModelRegistry modelRegistry;
    private final ContentEntryAccess entryAccess;
    private final MediaAccess mediaAccess;
    private final ReferenceNormalizer referenceNormalizer;
    private final ContentWorkflow workflow;
    private final SettingsService settingsService;
    private final ActivityLogService activityLogService;
    private final ListingProperties listingProperties;
    private final Clock clock;

    public ResolvedEntry create(CreateEntryServiceRequest request) {
        Objects.requireNonNull(request, "request");
        CallerIdentity caller = request.caller();
        if (!caller.canAuthor()) {
            throw CmsException.forbidden("Only administrators and editors can create content");
        }
        CompiledModel model = modelRegistry.require(request.apiId());
        ObjectNode payload = referenceNormalizer.normalize(model, request.payload());

        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (CompiledField field : model.fields()) {
            JsonNode raw = payload.get(field.name());
            if (isAbsent(raw) && field.hasDefault()) {
                raw = field.defaultValue();
            }
            if (isAbsent(raw)) {
                if (field.required()) {
                    throw CmsException.fieldRequired(field.name());
                }
                continue;
            }
            FieldValue value = FieldValueCodec.decode(field, raw);
            if (field.required() && isBlankText(value)) {
                throw CmsException.fieldRequired(field.name());
            }
            values.put(field.name(), value);
        }
        verifyReferences(model, values);
        enforceUnique(model, values, null);

        long now = clock.millis();
        ContentEntry entry = ContentEntry.builder()
                .apiId(model.apiId())
                .entryId(EntryIds.generate())
                .data(toDocument(values))
                .state(EntryState.DRAFT)
                .createdBy(caller.userId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        entryAccess.save(entry);
        activityLogService.recordEntryCreated(caller, model.apiId(), entry.getEntryId());
        return new ResolvedEntry(entry, values);
    }

    public EntryPage list(ListEntriesServiceRequest request) {
        Objects.requireNonNull(request, "request");
        CompiledModel model = modelRegistry.require(request.apiId());
        int limit = listingProperties.clampLimit(request.limit());
        Comparator<ResolvedEntry> order = comparator(model, request.sort());

        List<ResolvedEntry> matching = entryAccess.findAllByApiId(model.apiId()).stream()
                .map(entry -> resolve(model, entry))
                .filter(entry -> matchesSearch(model, entry, request.search()))
                .sorted(order)
                .toList();

        int from = (int) Math.min((long) (request.page() - 1) * limit, matching.size());
        int to = Math.min(from + limit, matching.size());
        return new EntryPage(matching.subList(from, to), matching.size(), request.page(), limit);
    }

    public ResolvedEntry getById(String apiId, String entryId) {
        CompiledModel model = modelRegistry.require(apiId);
        return resolve(model, load(model, entryId));
    }

    public ResolvedEntry update(UpdateEntryServiceRequest request) {
        Objects.requireNonNull(request, "request");
        CallerIdentity caller = request.caller();
        CompiledModel model = modelRegistry.require(request.apiId());
        ContentEntry existing = load(model, request.entryId());
        requireModifiable(caller, existing);

        ObjectNode payload = referenceNormalizer.normalize(model, request.payload());
        Map<String, FieldValue> values = new LinkedHashMap<>(resolve(model, existing).values());
        Map<String, FieldValue> changed = new LinkedHashMap<>();
        for (CompiledField field : model.fields()) {
            if (!payload.has(field.name())) {
                continue;
            }
            JsonNode raw = payload.get(field.name());
            if (raw.isNull()) {
                values.remove(field.name());
                continue;
            }
            FieldValue value = FieldValueCodec.decode(field, raw);
            values.put(field.name(), value);
            changed.put(field.name(), value);
        }
        for (CompiledField field : model.fields()) {
            if (field.required() && (!values.containsKey(field.name()) || isBlankText(values.get(field.name())))) {
                throw CmsException.fieldRequired(field.name());
            }
        }
        verifyReferences(model, changed);
        enforceUnique(model, changed, existing.getEntryId());

        EntryState previousState = existing.getState();
        EntryState newState = previousState;
        if (payload.has(STATE_KEY)) {
            JsonNode requested = payload.get(STATE_KEY);
            if (!requested.isTextual()) {
                throw CmsException.validationFailed("State must be a string");
            }
            newState = resolveState(caller, previousState, requested.textValue());
        }

        ContentEntry updated = existing.toBuilder()
                .data(toDocument(values))
                .state(newState)
                .updatedAt(clock.millis())
                .build();
        entryAccess.save(updated);
        activityLogService.recordEntryUpdated(caller, model.apiId(), updated.getEntryId());
        if (newState != previousState) {
            activityLogService.recordStateChanged(caller, model.apiId(), updated.getEntryId(),
                    previousState, newState);
        }
        return new ResolvedEntry(updated, values);
    }

    public ResolvedEntry transition(TransitionEntryServiceRequest request) {
        Objects.requireNonNull(request, "request");
        CallerIdentity caller = request.caller();
        CompiledModel model = modelRegistry.require(request.apiId());
        ContentEntry existing = load(model, request.entryId());
        requireModifiable(caller, existing);

        EntryState previousState = existing.getState();
        EntryState newState = resolveState(caller, previousState, request.state());
        if (newState == previousState) {
            return resolve(model, existing);
        }
        ContentEntry updated = existing.toBuilder()
                .state(newState)
                .updatedAt(clock.millis())
                .build();
        entryAccess.save(updated);
        activityLogService.recordStateChanged(caller, model.apiId(), updated.getEntryId(),
                previousState, newState);
        return resolve(model, updated);
    }

    public void delete(String apiId, String entryId, CallerIdentity caller) {
        if (!caller.isPrivileged()) {
            throw CmsException.forbidden("Only administrators can delete content");
        }
        CompiledModel model = modelRegistry.require(apiId);
        ContentEntry existing = load(model, entryId);
        if (!entryAccess.delete(model.apiId(), existing.getEntryId())) {
            // Lost a race with a concurrent delete.
            throw CmsException.entryNotFound(model.apiId());
        }
        activityLogService.recordEntryDeleted(caller, model.apiId(), existing.getEntryId());
    }

    /**
     * Removes every entry of a content type, regardless of whether its model is still registered.
     *
     * @return the number of entries removed
     */
    public int deleteAll(String apiId) {
        return entryAccess.deleteAllByApiId(apiId);
    }

    private ContentEntry load(CompiledModel model, String entryId) {
        if (!EntryIds.isValid(entryId)) {
            throw CmsException.entryNotFound(model.apiId());
        }
        return entryAccess.findById(model.apiId(), entryId)
                .orElseThrow(() -> CmsException.entryNotFound(model.apiId()));
    }

    private void requireModifiable(CallerIdentity caller, ContentEntry entry) {
        if (!caller.mayModify(entry.getCreatedBy())) {
            throw CmsException.forbidden("Not allowed to modify this entry");
        }
    }

    private EntryState resolveState(CallerIdentity caller, EntryState current, String requested) {
        EntryState target = workflow.parseState(requested);
        if (target == current) {
            return current;
        }
        boolean approvalRequired = !caller.isPrivileged() && settingsService.isContentApprovalRequired();
        return workflow.resolve(current, target, caller.isPrivileged(), approvalRequired);
    }

    private void verifyReferences(CompiledModel model, Map<String, FieldValue> values) {
        for (CompiledField field : model.referenceFields()) {
            if (!(values.get(field.name()) instanceof RefValue ref)) {
                continue;
            }
            for (String id : ref.ids()) {
                boolean found = field.type() == FieldType.MEDIA
                        ? mediaAccess.exists(id)
                        : entryAccess.findById(field.relationTo(), id).isPresent();
                if (!found) {
                    throw CmsException.validationFailed("Field '" + field.name() + "' references unknown "
                            + (field.type() == FieldType.MEDIA ? "media" : field.relationTo()) + " '" + id + "'");
                }
            }
        }
    }

    private void enforceUnique(CompiledModel model, Map<String, FieldValue> values, String selfId) {
        List<CompiledField> unique = model.fields().stream()
                .filter(CompiledField::unique)
                .filter(f -> values.containsKey(f.name()))
                .toList();
        if (unique.isEmpty()) {
            return;
        }
        List<ContentEntry> others = entryAccess.findAllByApiId(model.apiId()).stream()
                .filter(e -> !e.getEntryId().equals(selfId))
                .toList();
        for (CompiledField field : unique) {
            FieldValue candidate = values.get(field.name());
            for (ContentEntry other : others) {
                JsonNode stored = other.getData().get(field.name());
                if (stored != null && FieldValueCodec.fromStorage(field, stored)
                        .filter(candidate::equals)
                        .isPresent()) {
                    throw CmsException.conflict("Field '" + field.name() + "' must be unique");
                }
            }
        }
    }

    private boolean matchesSearch(CompiledModel model, ResolvedEntry entry, String search) {
        if (search == null) {
            return true;
        }
        String needle = search.toLowerCase(Locale.ROOT);
        for (CompiledField field : model.searchableFields()) {
            if (entry.values().get(field.name()) instanceof TextValue text
                    && text.value().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private Comparator<ResolvedEntry> comparator(CompiledModel model, String sort) {
        boolean descending = sort.startsWith("-");
        String attribute = descending ? sort.substring(1) : sort;
        return byAttribute(model, attribute, descending)
                .thenComparing(e -> e.entry().getEntryId());
    }

    private Comparator<ResolvedEntry> byAttribute(CompiledModel model, String attribute, boolean descending) {
        switch (attribute) {
            case "id":
                return ordered(e -> e.entry().getEntryId(), descending);
            case "state":
                return ordered(e -> e.entry().getState().wireName(), descending);
            case "createdBy":
                return ordered(e -> e.entry().getCreatedBy(), descending);
            case "createdAt":
                return ordered(e -> e.entry().getCreatedAt(), descending);
            case "updatedAt":
                return ordered(e -> e.entry().getUpdatedAt(), descending);
            default:
                CompiledField field = model.field(attribute).orElseThrow(() ->
                        CmsException.validationFailed("Cannot sort by unknown attribute '" + attribute + "'"));
                return byField(field, descending);
        }
    }

    private static Comparator<ResolvedEntry> byField(CompiledField field, boolean descending) {
        String name = field.name();
        return switch (field.primitive()) {
            case STRING -> ordered(e -> e.values().get(name) instanceof TextValue text
                    ? text.value().toLowerCase(Locale.ROOT)
                    : null, descending);
            case NUMBER -> ordered(e -> e.values().get(name) instanceof NumberValue number
                    ? number.value()
                    : null, descending);
            case BOOLEAN -> ordered(e -> e.values().get(name) instanceof BoolValue bool
                    ? Boolean.valueOf(bool.value())
                    : null, descending);
            case TIMESTAMP -> ordered(e -> e.values().get(name) instanceof DateValue date
                    ? date.value()
                    : null, descending);
            case STRUCTURED, REFERENCE -> ordered(e -> {
                FieldValue value = e.values().get(name);
                return value == null ? null : FieldValueCodec.encode(value).toString();
            }, descending);
        };
    }

    // Missing values sort last in either direction.
    private static <T extends Comparable<? super T>> Comparator<ResolvedEntry> ordered(
            Function<ResolvedEntry, T> key, boolean descending) {
        Comparator<T> natural = Comparator.naturalOrder();
        return Comparator.comparing(key, Comparator.nullsLast(descending ? natural.reversed() : natural));
    }

    private ResolvedEntry resolve(CompiledModel model, ContentEntry entry) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        JsonNode data = entry.getData();
        for (CompiledField field : model.fields()) {
            JsonNode stored = data.get(field.name());
            if (stored == null || stored.isNull()) {
                continue;
            }
            FieldValueCodec.fromStorage(field, stored).ifPresent(v -> values.put(field.name(), v));
        }
        return new ResolvedEntry(entry, values);
    }

    private static ObjectNode toDocument(Map<String, FieldValue> values) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        values.forEach((name, value) -> document.set(name, FieldValueCodec.encode(value)));
        return document;
    }

    private static boolean isAbsent(JsonNode raw) {
        return raw == null || raw.isNull() || raw.isMissingNode();
    }

    private static boolean isBlankText(FieldValue value) {
        return value instanceof TextValue text && text.value().isBlank();
    }

    /**
     * A stored entry together with its typed field values, in declared field order. Values that
     * no longer fit the current model are left out.
     */
    public record ResolvedEntry(ContentEntry entry, Map<String, FieldValue> values) {
        public ResolvedEntry {
            Objects.requireNonNull(entry, "entry");
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    public record EntryPage(List<ResolvedEntry> entries, int totalCount, int page, int limit) {
        public EntryPage {
            entries = List.copyOf(entries);
        }

        public int pages() {
            return (totalCount + limit - 1) / limit;
        }
    }
}
