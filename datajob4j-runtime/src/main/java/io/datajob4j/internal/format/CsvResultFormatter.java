package io.datajob4j.internal.format;

import com.opencsv.exceptions.CsvException;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.FormatException;
import io.datajob4j.pipeline.ResultFormatter;
import io.datajob4j.utils.CellValues;

import java.io.IOException;
import java.io.StringReader;
import java.util.Objects;

/**
 * Renders results as CSV. The same text is attached to result mails and returned by test runs.
 *
 * <p>{@link #parse(String)} only types a cell when the typed value renders back to the same text, so
 * {@code format(parse(format(d)))} equals {@code format(d)}.
 */
public class CsvResultFormatter implements ResultFormatter {

    @Override
    public String format(Dataset dataset) throws FormatException {
        Objects.requireNonNull(dataset, "dataset must not be null");
        try {
            return CsvTables.write(dataset);
        } catch (IOException | RuntimeException e) {
            throw new FormatException("Failed to render CSV: " + e.getMessage(), e);
        }
    }

    @Override
    public Dataset parse(String text) throws FormatException {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return CsvTables.read(new StringReader(text), CellValues::parseCanonical, false);
        } catch (IOException | CsvException | IllegalArgumentException e) {
            throw new FormatException("Failed to parse CSV: " + e.getMessage(), e);
        }
    }
}
