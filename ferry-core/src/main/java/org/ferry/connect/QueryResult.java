package org.ferry.connect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rows of a query, every value rendered as text ({@code null} stays {@code null}).
 */
public final class QueryResult {

    private final List<Row> rows;

    public QueryResult(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of());
    }

    public static QueryResult of(List<Map<String, String>> rows) {
        List<Row> converted = new ArrayList<>();
        for (Map<String, String> row : rows) {
            converted.add(new Row(row));
        }
        return new QueryResult(converted);
    }

    public List<Row> rows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public long singleLong() {
        if (rows.isEmpty()) {
            throw new DatabaseAccessException("Expected one row but the query returned none");
        }
        Row first = rows.get(0);
        String value = first.values.values().stream().findFirst().orElse(null);
        if (value == null) {
            throw new DatabaseAccessException("Expected a number but the query returned NULL");
        }
        return Long.parseLong(value.trim());
    }

    public static final class Row {
        private static final Set<String> TRUE_VALUES = Set.of("t", "true", "yes", "y", "1", "on");
        private static final ObjectMapper JSON = new ObjectMapper();
        private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
        };

        private final Map<String, String> values;

        public Row(Map<String, String> values) {
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public String get(String column) {
            if (!values.containsKey(column)) {
                throw new IllegalArgumentException("Result has no column '" + column + "'");
            }
            return values.get(column);
        }

        public String require(String column) {
            String value = get(column);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("Column '" + column + "' is empty");
            }
            return value;
        }

        public boolean bool(String column) {
            String value = get(column);
            return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
        }

        public int integer(String column) {
            String value = get(column);
            return value == null ? 0 : Integer.parseInt(value.trim());
        }

        /**
         * Reads a JSON array of strings, as produced by {@code array_to_json}; {@code null} yields an empty list.
         *
         * @throws IllegalArgumentException if the value is not a JSON array of strings
         */
        public List<String> list(String column) {
            String value = get(column);
            if (value == null || value.isBlank()) {
                return List.of();
            }
            try {
                List<String> values = JSON.readValue(value, STRING_LIST);
                return values == null ? List.of() : List.copyOf(values);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Column '" + column + "' is not a JSON array: " + value, e);
            }
        }

        public Map<String, String> asMap() {
            return values;
        }
    }
}
