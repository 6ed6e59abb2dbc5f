package io.datajob4j.pipeline;

import io.datajob4j.core.Dataset;
import io.datajob4j.core.FormatException;

public interface ResultFormatter {

    String format(Dataset dataset) throws FormatException;

    /**
     * Inverse of {@link #format(Dataset)}.
     */
    Dataset parse(String text) throws FormatException;
}
