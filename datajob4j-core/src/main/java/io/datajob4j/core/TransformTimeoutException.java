package io.datajob4j.core;

import java.time.Duration;

public class TransformTimeoutException extends TransformException {

    private final Duration timeout;

    public TransformTimeoutException(Duration timeout) {
        super("Script execution timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
