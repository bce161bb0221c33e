package com.example.dyncms.service;

import com.example.dyncms.access.ContentTypeAccess;
import com.example.dyncms.models.FieldDefinition;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.requests.FieldHttpRequest;
import com.example.dyncms.requests.PutContentTypeServiceRequest;
import com.example.dyncms.schema.FieldValueCodec;
import com.example.dyncms.schema.ModelSynthesizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks a submitted content type definition and turns its fields into {@link FieldDefinition}s.
 * Every failure is an {@link CmsException.Code#INVALID_DEFINITION}.
 */
@Component
@RequiredArgsConstructor
public class ContentTypeValidator {

    static final Pattern API_ID = Pattern.compile("^[a-z][a-z0-9_]*$");
    static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    /** Attribute names every entry carries on the wire. */
    public static final Set<String> SYSTEM_ATTRIBUTES =
            Set.of("id", "state", "createdBy", "createdAt", "updatedAt");

    private final ContentTypeAccess contentTypeAccess;

    public List<FieldDefinition> validate(PutContentTypeServiceRequest request) {
        String apiId = request.apiId();
        if (apiId == null || apiId.isEmpty()) {
            throw CmsException.invalidDefinition("API ID is required");
        }
        if (!API_ID.matcher(apiId).matches()) {
            throw CmsException.invalidDefinition("API ID '" + apiId
                    + "' must start with a lowercase letter and contain only lowercase letters, digits and underscores");
        }
        if (request.displayName() == null || request.displayName().isEmpty()) {
            throw CmsException.invalidDefinition("Display name is required");
        }
        if (request.fields().isEmpty()) {
            throw CmsException.invalidDefinition("At least one field is required");
        }

        Set<String> seen = new HashSet<>();
        List<FieldDefinition> fields = new ArrayList<>(request.fields().size());
        for (FieldHttpRequest field : request.fields()) {
            FieldDefinition definition = validateField(apiId, field);
            if (!seen.add(definition.name())) {
                throw CmsException.invalidDefinition("Duplicate field name '" + definition.name() + "'");
            }
            fields.add(definition);
        }
        return List.copyOf(fields);
    }

    private FieldDefinition validateField(String apiId, FieldHttpRequest field) {
        if (field == null) {
            throw CmsException.invalidDefinition("Field definitions must not be null");
        }
        String name = field.name() == null ? null : field.name().trim();
        if (name == null || name.isEmpty()) {
            throw CmsException.invalidDefinition("Field name is required");
        }
        if (!FIELD_NAME.matcher(name).matches()) {
            throw CmsException.invalidDefinition("Field name '" + name
                    + "' must start with a letter and contain only letters, digits and underscores");
        }
        if (SYSTEM_ATTRIBUTES.contains(name)) {
            throw CmsException.invalidDefinition("Field name '" + name + "' is reserved");
        }
        if (field.displayName() == null || field.displayName().isBlank()) {
            throw CmsException.invalidDefinition("Field '" + name + "' needs a display name");
        }

        FieldType type = parseType(name, field.type());
        List<String> options = null;
        if (type == FieldType.ENUM) {
            options = validateOptions(name, field.options());
        }
        String relationTo = null;
        if (type == FieldType.RELATION) {
            relationTo = validateRelationTarget(apiId, name, field.relationTo());
        }

        FieldDefinition definition = FieldDefinition.builder()
                .name(name)
                .displayName(field.displayName().trim())
                .type(type)
                .required(Boolean.TRUE.equals(field.required()))
                .unique(Boolean.TRUE.equals(field.unique()))
                .defaultValue(field.defaultValue() == null || field.defaultValue().isNull()
                        ? null
                        : field.defaultValue())
                .options(options)
                .relationTo(relationTo)
                .relationMany(type == FieldType.RELATION && Boolean.TRUE.equals(field.relationMany()))
                .multiple(type == FieldType.MEDIA && Boolean.TRUE.equals(field.multiple()))
                .build();

        if (definition.defaultValue() != null) {
            try {
                FieldValueCodec.decode(ModelSynthesizer.compileField(definition), definition.defaultValue());
            } catch (CmsException ex) {
                throw CmsException.invalidDefinition("Default value of field '" + name + "' is invalid: "
                        + ex.getMessage());
            }
        }
        return definition;
    }

    private FieldType parseType(String name, String type) {
        if (type == null || type.isBlank()) {
            throw CmsException.invalidDefinition("Field '" + name + "' needs a type");
        }
        try {
            return FieldType.fromString(type);
        } catch (IllegalArgumentException ex) {
            throw CmsException.invalidDefinition("Field '" + name + "' has unknown type '" + type + "'");
        }
    }

    private List<String> validateOptions(String name, List<String> options) {
        if (options == null || options.isEmpty()) {
            throw CmsException.invalidDefinition("Enum field '" + name + "' needs at least one option");
        }
        List<String> cleaned = new ArrayList<>(options.size());
        for (String option : options) {
            if (option == null || option.isBlank()) {
                throw CmsException.invalidDefinition("Enum field '" + name + "' has a blank option");
            }
            if (cleaned.contains(option)) {
                throw CmsException.invalidDefinition("Enum field '" + name + "' repeats option '" + option + "'");
            }
            cleaned.add(option);
        }
        return cleaned;
    }

    private String validateRelationTarget(String apiId, String name, String relationTo) {
        if (relationTo == null || relationTo.isBlank()) {
            throw CmsException.invalidDefinition("Relation field '" + name + "' needs a target content type");
        }
        String target = relationTo.trim();
        if (!API_ID.matcher(target).matches()) {
            throw CmsException.invalidDefinition("Relation field '" + name + "' targets invalid API ID '"
                    + target + "'");
        }
        if (!target.equals(apiId) && contentTypeAccess.findByApiId(target).isEmpty()) {
            throw CmsException.invalidDefinition("Relation field '" + name + "' targets unknown content type '"
                    + target + "'");
        }
        return target;
    }
}
