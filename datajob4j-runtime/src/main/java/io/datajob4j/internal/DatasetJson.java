package io.datajob4j.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datajob4j.core.Dataset;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversions between JSON trees and {@link Dataset}s.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>array of objects: one row per object</li>
 *   <li>object with at least one array field: column oriented, scalar fields are repeated on every row</li>
 *   <li>any other object: a single row</li>
 * </ul>
 * Nested objects and arrays inside a cell are kept as their JSON text.
 */
public final class DatasetJson {

    private DatasetJson() {
    }

    /**
     * @throws IllegalArgumentException for any other shape
     */
    public static Dataset fromJson(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("no JSON content");
        }
        if (node.isArray()) {
            List<Map<String, Object>> records = new ArrayList<>(node.size());
            int i = 0;
            for (JsonNode element : node) {
                if (!element.isObject()) {
                    throw new IllegalArgumentException("array element " + i + " is " + typeName(element) + ", expected object");
                }
                records.add(toRecord(element));
                i++;
            }
            return Dataset.fromRecords(records);
        }
        if (node.isObject()) {
            if (hasArrayField(node)) {
                return fromColumns(node);
            }
            return Dataset.fromRecords(List.of(toRecord(node)));
        }
        throw new IllegalArgumentException("unexpected JSON " + typeName(node) + ", expected array or object");
    }

    /**
     * Positional form: an array of column names and an array of row arrays.
     *
     * @throws IllegalArgumentException when rows do not match the columns
     */
    public static Dataset fromTable(JsonNode columns, JsonNode rows) {
        if (columns == null || !columns.isArray()) {
            throw new IllegalArgumentException("columns must be an array");
        }
        List<String> names = new ArrayList<>(columns.size());
        for (JsonNode c : columns) {
            names.add(c.asText());
        }
        List<List<Object>> cells = new ArrayList<>();
        if (rows != null && !rows.isNull()) {
            if (!rows.isArray()) {
                throw new IllegalArgumentException("rows must be an array");
            }
            for (JsonNode r : rows) {
                if (!r.isArray()) {
                    throw new IllegalArgumentException("row " + cells.size() + " is " + typeName(r) + ", expected array");
                }
                List<Object> row = new ArrayList<>(r.size());
                r.forEach(v -> row.add(cell(v)));
                cells.add(row);
            }
        }
        return Dataset.of(names, cells);
    }

    /**
     * Array of row objects, in column order.
     */
    public static ArrayNode toJson(Dataset dataset, ObjectMapper objectMapper) {
        ArrayNode array = objectMapper.createArrayNode();
        for (List<Object> row : dataset.rows()) {
            ObjectNode obj = array.addObject();
            for (int i = 0; i < dataset.columnCount(); i++) {
                String column = dataset.columns().get(i);
                Object cell = row.get(i);
                if (cell == null) {
                    obj.putNull(column);
                } else if (cell instanceof Boolean b) {
                    obj.put(column, b);
                } else if (cell instanceof Long l) {
                    obj.put(column, l);
                } else if (cell instanceof BigInteger bi) {
                    obj.put(column, bi);
                } else if (cell instanceof Double d) {
                    if (d.isNaN() || d.isInfinite()) {
                        obj.putNull(column);
                    } else {
                        obj.put(column, d);
                    }
                } else {
                    obj.put(column, cell.toString());
                }
            }
        }
        return array;
    }

    private static Dataset fromColumns(JsonNode node) {
        int length = -1;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isArray()) {
                int n = e.getValue().size();
                if (length >= 0 && n != length) {
                    throw new IllegalArgumentException("column arrays must all have the same length, '"
                            + e.getKey() + "' has " + n + ", expected " + length);
                }
                length = n;
            }
        }

        List<String> columns = new ArrayList<>();
        node.fieldNames().forEachRemaining(columns::add);

        List<List<Object>> rows = new ArrayList<>(length);
        for (int r = 0; r < length; r++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (String c : columns) {
                JsonNode v = node.get(c);
                row.add(cell(v.isArray() ? v.get(r) : v));
            }
            rows.add(row);
        }
        return Dataset.of(columns, rows);
    }

    private static boolean hasArrayField(JsonNode node) {
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            if (values.next().isArray()) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> toRecord(JsonNode obj) {
        Map<String, Object> record = new LinkedHashMap<>();
        obj.fields().forEachRemaining(e -> record.put(e.getKey(), cell(e.getValue())));
        return record;
    }

    private static Object cell(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) {
            return null;
        }
        if (v.isBoolean()) {
            return v.booleanValue();
        }
        if (v.isIntegralNumber()) {
            return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
        }
        if (v.isNumber()) {
            return v.doubleValue();
        }
        if (v.isTextual()) {
            return v.textValue();
        }
        return v.toString();
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
