package io.datajob4j.core;

import java.util.Objects;

/**
 * Base type for failures raised by a pipeline stage. Always carries the {@link Stage} that failed.
 */
public class PipelineException extends Exception {

    private final Stage stage;

    public PipelineException(Stage stage, String message) {
        this(stage, message, null);
    }

    public PipelineException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
    }

    public Stage stage() {
        return stage;
    }
}
