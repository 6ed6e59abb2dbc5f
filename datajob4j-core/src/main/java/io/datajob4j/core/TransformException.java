package io.datajob4j.core;

/**
 * The transformation code failed, was rejected before running, or produced an unusable result.
 */
public class TransformException extends PipelineException {

    public TransformException(String message) {
        super(Stage.TRANSFORM, message);
    }

    public TransformException(String message, Throwable cause) {
        super(Stage.TRANSFORM, message, cause);
    }
}
