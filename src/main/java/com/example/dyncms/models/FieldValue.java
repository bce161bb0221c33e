package com.example.dyncms.models;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Typed value of a single entry field. One variant per {@link StoragePrimitive}; conversion to and
 * from JSON happens at the wire and storage boundaries only.
 */
public sealed interface FieldValue
        permits FieldValue.TextValue, FieldValue.NumberValue, FieldValue.BoolValue,
                FieldValue.DateValue, FieldValue.JsonValue, FieldValue.RefValue {

    record TextValue(String value) implements FieldValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record NumberValue(BigDecimal value) implements FieldValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberValue other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
    }

    record BoolValue(boolean value) implements FieldValue { }

    /**
     * A point in time. {@code dateOnly} values were submitted as calendar dates and render back
     * as {@code yyyy-MM-dd}.
     */
    record DateValue(Instant value, boolean dateOnly) implements FieldValue {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record JsonValue(JsonNode value) implements FieldValue {
        public JsonValue {
            Objects.requireNonNull(value, "value");
            if (value.isMissingNode()) {
                throw new IllegalArgumentException("json value must not be a missing node");
            }
        }
    }

    /**
     * One or more identifiers. {@code many} mirrors the field's cardinality so a single-valued
     * reference renders as a plain string.
     */
    record RefValue(List<String> ids, boolean many) implements FieldValue {
        public RefValue {
            ids = List.copyOf(ids);
            if (!many && ids.size() != 1) {
                throw new IllegalArgumentException("single reference must hold exactly one id");
            }
        }

        public static RefValue single(String id) {
            return new RefValue(List.of(id), false);
        }
    }
}
