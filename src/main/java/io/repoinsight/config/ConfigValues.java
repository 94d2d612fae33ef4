package io.repoinsight.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to one section of a loaded YAML document.
 * A present value of the wrong type is a configuration error.
 */
final class ConfigValues {

    private final String section;
    private final Map<String, Object> values;

    ConfigValues(String section, Map<String, Object> values) {
        this.section = section;
        this.values = values;
    }

    Optional<Boolean> bool(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        throw invalid(key, "a boolean", value);
    }

    Optional<Integer> integer(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Integer i) {
            return Optional.of(i);
        }
        if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return Optional.of(l.intValue());
        }
        throw invalid(key, "an integer", value);
    }

    Optional<Double> decimal(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        throw invalid(key, "a number", value);
    }

    Optional<String> string(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String s) {
            return Optional.of(s);
        }
        throw invalid(key, "a string", value);
    }

    Optional<List<String>> strings(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof String s)) {
                    throw invalid(key, "a list of strings", value);
                }
                result.add(s);
            }
            return Optional.of(List.copyOf(result));
        }
        throw invalid(key, "a list of strings", value);
    }

    @SuppressWarnings("unchecked")
    Optional<List<Map<String, Object>>> maps(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            List<Map<String, Object>> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> map)) {
                    throw invalid(key, "a list of mappings", value);
                }
                result.add((Map<String, Object>) map);
            }
            return Optional.of(result);
        }
        throw invalid(key, "a list of mappings", value);
    }

    private IllegalArgumentException invalid(String key, String expected, Object actual) {
        return new IllegalArgumentException(section + "." + key + " must be " + expected + ", got: " + actual);
    }
}
