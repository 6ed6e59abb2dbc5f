package io.datajob4j.core;

public class FormatException extends PipelineException {

    public FormatException(String message) {
        super(Stage.FORMAT, message);
    }

    public FormatException(String message, Throwable cause) {
        super(Stage.FORMAT, message, cause);
    }
}
