package com.example.dyncms.schema;

import com.example.dyncms.models.EntryIds;
import com.example.dyncms.models.FieldType;
import com.example.dyncms.models.FieldValue;
import com.example.dyncms.models.FieldValue.BoolValue;
import com.example.dyncms.models.FieldValue.DateValue;
import com.example.dyncms.models.FieldValue.JsonValue;
import com.example.dyncms.models.FieldValue.NumberValue;
import com.example.dyncms.models.FieldValue.RefValue;
import com.example.dyncms.models.FieldValue.TextValue;
import com.example.dyncms.service.CmsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Coerces JSON values into {@link FieldValue}s according to the field type vocabulary and
 * renders them back. The same rules apply on the wire and in storage, with the exception of
 * {@link #fromStorage}, which tolerates values written under an older definition.
 */
@Slf4j
public final class FieldValueCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");
    private static final int CALENDAR_DATE_LENGTH = "yyyy-MM-dd".length();

    private FieldValueCodec() {
    }

    /**
     * Coerces an incoming value. Reference existence is not checked here.
     *
     * @throws CmsException with code VALIDATION_FAILED naming the field
     */
    public static FieldValue decode(CompiledField field, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            throw invalid(field, "must not be null");
        }
        return switch (field.primitive()) {
            case STRING -> decodeText(field, raw);
            case NUMBER -> decodeNumber(field, raw);
            case BOOLEAN -> decodeBoolean(field, raw);
            case TIMESTAMP -> decodeDate(field, raw);
            case STRUCTURED -> decodeJson(field, raw);
            case REFERENCE -> decodeReference(field, raw);
        };
    }

    /**
     * Reads a stored value under the current model. Values that no longer fit (the definition was
     * replaced with a different type) are skipped rather than failing the read.
     */
    public static Optional<FieldValue> fromStorage(CompiledField field, JsonNode stored) {
        if (stored == null || stored.isNull() || stored.isMissingNode()) {
            return Optional.empty();
        }
        if (field.type() == FieldType.JSON) {
            return Optional.of(new JsonValue(stored));
        }
        try {
            return Optional.of(decode(field, stored));
        } catch (CmsException ex) {
            log.debug("Skipping stored value that no longer fits: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public static JsonNode encode(FieldValue value) {
        if (value instanceof TextValue text) {
            return NODES.textNode(text.value());
        }
        if (value instanceof NumberValue number) {
            return numberNode(number.value());
        }
        if (value instanceof BoolValue bool) {
            return NODES.booleanNode(bool.value());
        }
        if (value instanceof DateValue date) {
            return NODES.textNode(formatDate(date));
        }
        if (value instanceof JsonValue json) {
            return json.value().deepCopy();
        }
        RefValue ref = (RefValue) value;
        if (!ref.many()) {
            return NODES.textNode(ref.ids().get(0));
        }
        ArrayNode array = NODES.arrayNode();
        ref.ids().forEach(array::add);
        return array;
    }

    public static String formatDate(DateValue date) {
        return date.dateOnly()
                ? LocalDate.ofInstant(date.value(), ZoneOffset.UTC).toString()
                : date.value().toString();
    }

    private static FieldValue decodeText(CompiledField field, JsonNode raw) {
        if (!raw.isTextual()) {
            throw invalid(field, "must be a string");
        }
        String text = raw.textValue();
        if (field.type() == FieldType.ENUM && !field.options().contains(text)) {
            throw invalid(field, "must be one of " + field.options());
        }
        if (field.type() == FieldType.EMAIL && !EMAIL.matcher(text).matches()) {
            throw invalid(field, "must be a valid email address");
        }
        return new TextValue(text);
    }

    private static FieldValue decodeNumber(CompiledField field, JsonNode raw) {
        if (raw.isNumber()) {
            return new NumberValue(raw.decimalValue());
        }
        if (raw.isTextual()) {
            try {
                return new NumberValue(new BigDecimal(raw.textValue().trim()));
            } catch (NumberFormatException ex) {
                throw invalid(field, "must be a number");
            }
        }
        throw invalid(field, "must be a number");
    }

    private static FieldValue decodeBoolean(CompiledField field, JsonNode raw) {
        if (raw.isBoolean()) {
            return new BoolValue(raw.booleanValue());
        }
        if (raw.isTextual()) {
            String text = raw.textValue().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return new BoolValue(Boolean.parseBoolean(text));
            }
        }
        throw invalid(field, "must be a boolean");
    }

    private static FieldValue decodeDate(CompiledField field, JsonNode raw) {
        if (raw.isIntegralNumber()) {
            return new DateValue(Instant.ofEpochMilli(raw.longValue()), false);
        }
        if (!raw.isTextual()) {
            throw invalid(field, "must be an ISO-8601 date");
        }
        String text = raw.textValue().trim();
        try {
            if (text.length() == CALENDAR_DATE_LENGTH) {
                LocalDate date = LocalDate.parse(text);
                return new DateValue(date.atStartOfDay(ZoneOffset.UTC).toInstant(), true);
            }
            return new DateValue(parseDateTime(text), false);
        } catch (DateTimeParseException ex) {
            throw invalid(field, "must be an ISO-8601 date");
        }
    }

    // Date-times without an offset are read as UTC.
    private static Instant parseDateTime(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ex) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    private static FieldValue decodeJson(CompiledField field, JsonNode raw) {
        if (!raw.isTextual()) {
            return new JsonValue(raw.deepCopy());
        }
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(raw.textValue());
        } catch (JsonProcessingException ex) {
            throw invalid(field, "must be valid JSON");
        }
        // readTree answers blank input with a missing node rather than an error.
        if (parsed == null || parsed.isMissingNode()) {
            throw invalid(field, "must be valid JSON");
        }
        if (parsed.isNull()) {
            throw invalid(field, "must not be null");
        }
        return new JsonValue(parsed);
    }

    private static FieldValue decodeReference(CompiledField field, JsonNode raw) {
        List<String> ids = new ArrayList<>();
        if (raw.isArray()) {
            for (JsonNode element : raw) {
                ids.add(referenceId(field, element));
            }
        } else {
            ids.add(referenceId(field, raw));
        }
        if (ids.isEmpty()) {
            throw invalid(field, "must reference at least one item");
        }
        if (!field.many() && ids.size() > 1) {
            throw invalid(field, "accepts a single reference");
        }
        return new RefValue(ids, field.many());
    }

    private static String referenceId(CompiledField field, JsonNode element) {
        if (!element.isTextual() || !EntryIds.isValid(element.textValue())) {
            throw invalid(field, "contains an invalid reference");
        }
        return element.textValue();
    }

    private static JsonNode numberNode(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19) {
            return NODES.numberNode(stripped.longValueExact());
        }
        return DecimalNode.valueOf(value);
    }

    private static CmsException invalid(CompiledField field, String reason) {
        return CmsException.validationFailed("Field '" + field.name() + "' " + reason);
    }
}
