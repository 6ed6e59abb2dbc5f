package io.datajob4j.internal.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datajob4j.core.Dataset;
import io.datajob4j.internal.DatasetJson;
import io.datajob4j.utils.CellValues;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Numeric column kinds of a transform input.
 * <p>
 * Script numbers are doubles: a whole double comes back as an integer, and an integer beyond 2^53 would be
 * rounded. Unsafe integers therefore travel as decimal strings, and columns keep the numeric kind they had on the
 * way in.
 */
final class ColumnKinds {

    static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

    private static final Pattern INTEGER_TEXT = Pattern.compile("-?\\d+");

    enum Kind {DOUBLE, INTEGER, OTHER}

    private final Map<String, Kind> kinds;

    private ColumnKinds(Map<String, Kind> kinds) {
        this.kinds = kinds;
    }

    /**
     * A column is DOUBLE or INTEGER when every non-null cell is of that kind and there is at least one.
     */
    static ColumnKinds of(Dataset input) {
        Map<String, Kind> kinds = new HashMap<>();
        for (int c = 0; c < input.columnCount(); c++) {
            Kind kind = null;
            for (List<Object> row : input.rows()) {
                Object cell = row.get(c);
                if (cell == null) {
                    continue;
                }
                Kind k = cell instanceof Double ? Kind.DOUBLE
                        : (cell instanceof Long || cell instanceof BigInteger) ? Kind.INTEGER
                        : Kind.OTHER;
                if (kind == null) {
                    kind = k;
                } else if (kind != k) {
                    kind = Kind.OTHER;
                    break;
                }
            }
            kinds.put(input.columns().get(c), kind == null ? Kind.OTHER : kind);
        }
        return new ColumnKinds(kinds);
    }

    Kind kindOf(String column) {
        return kinds.getOrDefault(column, Kind.OTHER);
    }

    /**
     * Rows for the script, with integers outside the exact double range as strings.
     */
    static ArrayNode toScriptJson(Dataset input, ObjectMapper objectMapper) {
        ArrayNode rows = DatasetJson.toJson(input, objectMapper);
        for (JsonNode row : rows) {
            ObjectNode obj = (ObjectNode) row;
            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode v = field.getValue();
                if (v.isIntegralNumber() && !isSafe(v)) {
                    field.setValue(obj.textNode(v.asText()));
                }
            }
        }
        return rows;
    }

    /**
     * Put back the numeric kind of every column that also existed on the input.
     */
    Dataset restore(Dataset output) {
        boolean touched = false;
        List<List<Object>> rows = new ArrayList<>(output.rowCount());
        for (List<Object> row : output.rows()) {
            List<Object> restored = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                Object cell = row.get(c);
                Object fixed = restore(kindOf(output.columns().get(c)), cell);
                touched |= fixed != cell;
                restored.add(fixed);
            }
            rows.add(restored);
        }
        return touched ? Dataset.of(output.columns(), rows) : output;
    }

    private static Object restore(Kind kind, Object cell) {
        if (kind == Kind.DOUBLE && (cell instanceof Long || cell instanceof BigInteger)) {
            return ((Number) cell).doubleValue();
        }
        if (kind == Kind.INTEGER && cell instanceof String s && INTEGER_TEXT.matcher(s).matches()) {
            BigInteger value = new BigInteger(s);
            if (value.abs().compareTo(BigInteger.valueOf(MAX_SAFE_INTEGER)) > 0) {
                return CellValues.normalize(value);
            }
        }
        return cell;
    }

    private static boolean isSafe(JsonNode v) {
        return v.canConvertToLong() && Math.abs(v.longValue()) <= MAX_SAFE_INTEGER;
    }
}
