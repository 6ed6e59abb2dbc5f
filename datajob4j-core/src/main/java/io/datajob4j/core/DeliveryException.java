package io.datajob4j.core;

/**
 * A notification could not be delivered after all attempts.
 */
public class DeliveryException extends PipelineException {

    public DeliveryException(String message) {
        super(Stage.DELIVERY, message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(Stage.DELIVERY, message, cause);
    }
}
