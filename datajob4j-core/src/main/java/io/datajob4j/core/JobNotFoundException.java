package io.datajob4j.core;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {

    public JobNotFoundException(String name) {
        super("Job '" + name + "' not found");
    }
}
