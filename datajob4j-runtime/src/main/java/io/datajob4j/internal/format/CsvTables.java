package io.datajob4j.internal.format;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import io.datajob4j.core.Dataset;
import io.datajob4j.utils.CellValues;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * CSV reading and writing for {@link Dataset}s: comma separated, RFC 4180 quoting, {@code \n} line ends,
 * header row first.
 */
public final class CsvTables {

    private CsvTables() {
    }

    public static String write(Dataset dataset) throws IOException {
        if (dataset.columnCount() == 0) {
            return "";
        }
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out, ',', '"', '"', "\n")) {
            writer.writeNext(dataset.columns().toArray(new String[0]), false);
            for (List<Object> row : dataset.rows()) {
                String[] cells = new String[row.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = CellValues.render(row.get(i));
                }
                writer.writeNext(cells, false);
            }
        }
        return out.toString();
    }

    /**
     * Read a table. Missing trailing cells become null; extra cells are an error.
     *
     * @param cellParser    typing rule per cell
     * @param userFile      lenient handling for hand-made files: skip blank lines, strip a BOM and CRs
     * @throws IllegalArgumentException when a row is wider than the header or column names repeat
     */
    public static Dataset read(Reader reader, Function<String, Object> cellParser, boolean userFile)
            throws IOException, CsvException {
        try (CSVReader csv = new CSVReaderBuilder(reader)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .withKeepCarriageReturn(!userFile)
                .build()) {
            List<String[]> lines = csv.readAll();
            if (lines.isEmpty()) {
                return Dataset.empty();
            }

            String[] header = lines.get(0);
            if (userFile && header.length > 0 && header[0].startsWith("\uFEFF")) {
                header[0] = header[0].substring(1);
            }
            List<String> columns = Arrays.asList(header);

            List<List<Object>> rows = new ArrayList<>(lines.size() - 1);
            for (int i = 1; i < lines.size(); i++) {
                String[] line = lines.get(i);
                if (userFile && isBlank(line)) {
                    continue;
                }
                if (line.length > columns.size()) {
                    throw new IllegalArgumentException("line " + (i + 1) + " has " + line.length
                            + " fields, header has " + columns.size());
                }
                List<Object> row = new ArrayList<>(columns.size());
                for (int c = 0; c < columns.size(); c++) {
                    row.add(c < line.length ? cellParser.apply(line[c]) : null);
                }
                rows.add(row);
            }
            return Dataset.of(columns, rows);
        }
    }

    private static boolean isBlank(String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].isBlank());
    }
}
