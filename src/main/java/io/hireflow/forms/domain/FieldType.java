package io.hireflow.forms.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldType {
    SHORT_TEXT,
    LONG_TEXT,
    EMAIL,
    YES_NO,
    SELECT,
    DATE,
    FILE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FieldType> fromWire(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        final String normalised = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalised))
                .findFirst();
    }

    @JsonCreator
    public static FieldType of(final String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + value));
    }
}
