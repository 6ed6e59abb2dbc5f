package io.datajob4j.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FileFormat {

    CSV("csv"),
    JSON("json");

    private final String value;

    FileFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FileFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("file format must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (FileFormat f : values()) {
            if (f.value.equals(v)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unsupported file format: " + value + " (expected csv or json)");
    }
}
