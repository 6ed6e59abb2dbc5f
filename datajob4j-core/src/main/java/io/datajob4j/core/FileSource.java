package io.datajob4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Local file source. The format selects the parser.
 */
public record FileSource(
        @JsonProperty("location") String path,
        @JsonProperty("file_type") FileFormat format
) implements DataSource {

    public FileSource {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(format, "file source requires a format (csv or json)");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }

    @Override
    public String location() {
        return path;
    }
}
