package io.datajob4j.pipeline;

import io.datajob4j.core.Dataset;
import io.datajob4j.core.TransformException;

import java.time.Duration;

/**
 * Executes user transformation code against a private copy of a dataset under a wall-clock budget.
 */
public interface TransformRunner {

    /**
     * Run with the configured default timeout.
     */
    Dataset run(String code, Dataset input) throws TransformException;

    Dataset run(String code, Dataset input, Duration timeout) throws TransformException;
}
