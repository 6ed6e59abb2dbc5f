package io.datajob4j.core;

/**
 * Job registry persistence failed (I/O error or unreadable store).
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
