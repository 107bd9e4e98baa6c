package com.workflow.action;

import com.workflow.exception.ActionParameterException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Narrows the untyped parameter map a handler receives into typed values, failing with an
 * {@link ActionParameterException} that names the action and the offending parameter.
 */
public final class ActionParameters {

    private final String action;
    private final Map<String, Object> values;

    private ActionParameters(String action, Map<String, Object> values) {
        this.action = action;
        this.values = values == null ? Map.of() : values;
    }

    public static ActionParameters of(String action, Map<String, Object> values) {
        return new ActionParameters(action, values);
    }

    public boolean has(String name) {
        Object value = values.get(name);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public Object raw(String name) {
        return values.get(name);
    }

    public String requireString(String name) {
        if (!has(name)) {
            throw missing(name);
        }
        return String.valueOf(values.get(name)).trim();
    }

    public String optionalString(String name, String defaultValue) {
        return has(name) ? String.valueOf(values.get(name)).trim() : defaultValue;
    }

    public Integer optionalInt(String name) {
        if (!has(name)) {
            return null;
        }
        Object value = values.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ActionParameterException(action, name, "expected an integer but got '" + value + "'");
        }
    }

    /**
     * Reads a tabular dataset: a list of rows, each a map from column name to value.
     * Values are converted to strings; {@code null} values become empty strings.
     */
    public List<Map<String, String>> requireRows(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw missing(name);
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new ActionParameterException(action, name, "expected a list of rows but got " + value.getClass().getSimpleName());
        }
        List<Map<String, String>> rows = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (!(element instanceof Map<?, ?> row)) {
                throw new ActionParameterException(action, name, "every row must be a map of column to value");
            }
            Map<String, String> narrowed = new LinkedHashMap<>();
            row.forEach((key, cell) -> narrowed.put(String.valueOf(key), cell == null ? "" : String.valueOf(cell)));
            rows.add(narrowed);
        }
        return rows;
    }

    /**
     * Reads a string-to-string mapping given either as a map or as {@code "k=v,k2=v2"}.
     */
    public Map<String, String> optionalStringMap(String name) {
        Object value = values.get(name);
        Map<String, String> result = new LinkedHashMap<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, entry) -> result.put(String.valueOf(key), entry == null ? "" : String.valueOf(entry)));
            return result;
        }
        if (value instanceof String text) {
            for (String pair : text.split(",")) {
                if (pair.isBlank()) {
                    continue;
                }
                int separator = pair.indexOf('=');
                if (separator <= 0) {
                    throw new ActionParameterException(action, name, "expected key=value pairs but got '" + pair.trim() + "'");
                }
                result.put(pair.substring(0, separator).trim(), pair.substring(separator + 1).trim());
            }
            return result;
        }
        throw new ActionParameterException(action, name, "expected a map or key=value list but got " + value.getClass().getSimpleName());
    }

    /**
     * Reads a list of strings given either as a collection or as a comma-separated string.
     */
    public List<String> optionalStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).map(String::trim).toList();
        }
        return Arrays.stream(String.valueOf(value).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Reads a nested map, e.g. an analysis summary produced by an earlier step.
     */
    public Map<String, Object> optionalMap(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ActionParameterException(action, name, "expected a map but got " + value.getClass().getSimpleName());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, entry) -> result.put(String.valueOf(key), entry));
        return result;
    }

    private ActionParameterException missing(String name) {
        return new ActionParameterException(action, name, "is required");
    }
}
