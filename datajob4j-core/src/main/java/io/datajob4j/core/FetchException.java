package io.datajob4j.core;

/**
 * The data source was unreachable, missing, or its content could not be parsed.
 */
public class FetchException extends PipelineException {

    public FetchException(String message) {
        super(Stage.FETCH, message);
    }

    public FetchException(String message, Throwable cause) {
        super(Stage.FETCH, message, cause);
    }
}
