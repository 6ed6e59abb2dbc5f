package io.datajob4j.core;

import io.datajob4j.utils.CellValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable rectangular table: ordered, unique column names and rows of normalized cells
 * (see {@link CellValues#normalize(Object)}).
 * <p>
 * A dataset without columns never has rows.
 */
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(List.of(), List.of());

    private final List<String> columns;
    private final List<List<Object>> rows;

    private Dataset(List<String> columns, List<List<Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Build from column names and positional rows. Cells are normalized and copied.
     */
    public static Dataset of(List<String> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");

        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (c == null) {
                throw new IllegalArgumentException("column name must not be null");
            }
            if (!seen.add(c)) {
                throw new IllegalArgumentException("Duplicate column name: " + c);
            }
        }
        if (columns.isEmpty() && !rows.isEmpty()) {
            throw new IllegalArgumentException("a dataset without columns cannot have rows");
        }

        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalArgumentException("row " + i + " has " + (row == null ? 0 : row.size())
                        + " cells, expected " + columns.size());
            }
            List<Object> cells = new ArrayList<>(row.size());
            for (Object cell : row) {
                cells.add(CellValues.normalize(cell));
            }
            copy.add(Collections.unmodifiableList(cells));
        }
        return new Dataset(List.copyOf(columns), Collections.unmodifiableList(copy));
    }

    /**
     * Build from row objects. Columns are the union of keys in first-seen order; missing keys become null.
     */
    public static Dataset fromRecords(List<? extends Map<String, ?>> records) {
        Objects.requireNonNull(records, "records must not be null");
        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            if (record == null) {
                throw new IllegalArgumentException("record must not be null");
            }
            keys.addAll(record.keySet());
        }
        if (keys.isEmpty()) {
            return EMPTY;
        }
        List<String> columns = new ArrayList<>(keys);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String c : columns) {
                row.add(record.get(c));
            }
            rows.add(row);
        }
        return of(columns, rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Object get(int row, String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(idx);
    }

    /**
     * Rows as ordered maps keyed by column name.
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                m.put(columns.get(i), row.get(i));
            }
            out.add(m);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset other)) return false;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
