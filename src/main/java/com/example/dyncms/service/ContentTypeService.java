package com.example.dyncms.service;

import com.example.dyncms.access.ContentEntryAccess;
import com.example.dyncms.access.ContentTypeAccess;
import com.example.dyncms.models.ContentTypeDefinition;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.requests.PutContentTypeServiceRequest;
import com.example.dyncms.schema.ModelSynthesizer;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Owns content type definitions. Every successful mutation recompiles the affected model before
 * returning, so the next content request already sees the new shape.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentTypeService {

    private final ContentTypeAccess contentTypeAccess;
    private final ContentEntryAccess entryAccess;
    private final ContentTypeValidator validator;
    private final ModelSynthesizer synthesizer;
    private final ContentEntryService entryService;
    private final ActivityLogService activityLogService;
    private final Clock clock;

    public ContentTypeDefinition define(PutContentTypeServiceRequest request, CallerIdentity caller) {
        Objects.requireNonNull(request, "request");
        requirePrivileged(caller);
        List<FieldDefinition> fields = validator.validate(request);
        if (contentTypeAccess.findByApiId(request.apiId()).isPresent()) {
            throw CmsException.contentTypeAlreadyExists(request.apiId());
        }

        long now = clock.millis();
        ContentTypeDefinition definition = ContentTypeDefinition.builder()
                .apiId(request.apiId())
                .displayName(request.displayName())
                .description(request.description())
                .fields(fields)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            contentTypeAccess.save(definition);
        } catch (ConditionalCheckFailedException ex) {
            throw CmsException.contentTypeAlreadyExists(request.apiId());
        }
        synthesizer.synthesize(definition);
        activityLogService.recordContentTypeCreated(caller, definition);
        return definition;
    }

    public ContentTypeDefinition get(String apiId) {
        return contentTypeAccess.findByApiId(apiId)
                .orElseThrow(() -> CmsException.contentTypeNotFound(apiId));
    }

    public List<ContentTypeDefinition> list() {
        return contentTypeAccess.findAll().stream()
                .sorted(Comparator.comparing(ContentTypeDefinition::getApiId))
                .toList();
    }

    /**
     * Replaces a definition wholesale. The submitted apiId may differ from {@code apiId}, which
     * renames the type; that is only allowed while the type has no entries.
     */
    public ContentTypeDefinition replace(String apiId, PutContentTypeServiceRequest request, CallerIdentity caller) {
        Objects.requireNonNull(request, "request");
        requirePrivileged(caller);
        ContentTypeDefinition existing = get(apiId);
        List<FieldDefinition> fields = validator.validate(request);

        ContentTypeDefinition replacement = existing.toBuilder()
                .apiId(request.apiId())
                .displayName(request.displayName())
                .description(request.description())
                .fields(fields)
                .updatedAt(clock.millis())
                .build();

        if (apiId.equals(request.apiId())) {
            contentTypeAccess.update(replacement);
            synthesizer.synthesize(replacement);
        } else {
            rename(existing, replacement);
        }
        activityLogService.recordContentTypeUpdated(caller, apiId, replacement);
        return replacement;
    }

    public ContentTypeDeletionResult remove(String apiId, CallerIdentity caller) {
        requirePrivileged(caller);
        ContentTypeDefinition existing = get(apiId);

        // Unregister first so no new entries are accepted while the old ones are removed.
        synthesizer.drop(apiId);
        int entriesDeleted = entryService.deleteAll(apiId);
        contentTypeAccess.delete(apiId);
        log.info("Deleted content type {} with {} entries", apiId, entriesDeleted);

        activityLogService.recordContentTypeDeleted(caller, apiId, entriesDeleted);
        return new ContentTypeDeletionResult(existing, entriesDeleted);
    }

    private void rename(ContentTypeDefinition existing, ContentTypeDefinition replacement) {
        String from = existing.getApiId();
        String to = replacement.getApiId();
        if (contentTypeAccess.findByApiId(to).isPresent()) {
            throw CmsException.contentTypeAlreadyExists(to);
        }
        if (entryAccess.hasEntries(from)) {
            throw CmsException.conflict("Content type '" + from + "' still has entries and cannot be renamed");
        }
        try {
            contentTypeAccess.save(replacement);
        } catch (ConditionalCheckFailedException ex) {
            throw CmsException.contentTypeAlreadyExists(to);
        }
        contentTypeAccess.delete(from);
        synthesizer.drop(from);
        synthesizer.synthesize(replacement);
        log.info("Renamed content type {} to {}", from, to);
    }

    private static void requirePrivileged(CallerIdentity caller) {
        Objects.requireNonNull(caller, "caller");
        if (!caller.isPrivileged()) {
            throw CmsException.forbidden("Only administrators can manage content types");
        }
    }

    public record ContentTypeDeletionResult(ContentTypeDefinition definition, int entriesDeleted) {
    }
}
