package io.datajob4j.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where a job reads its input from. Persisted with a {@code source_type} tag of {@code api} or {@code file}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "source_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ApiSource.class, name = "api"),
        @JsonSubTypes.Type(value = FileSource.class, name = "file")
})
public interface DataSource {

    /**
     * URL or file path, for logs and messages.
     */
    String location();
}
