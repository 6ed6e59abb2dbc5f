package io.datajob4j.core;

public class DuplicateJobException extends IllegalStateException {

    public DuplicateJobException(String name) {
        super("Job with name '" + name + "' already exists");
    }
}
