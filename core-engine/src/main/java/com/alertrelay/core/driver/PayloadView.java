package com.alertrelay.core.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Null-safe, read-only view over a free-form JSON object.
 *
 * <p>
 * Webhook payloads arrive as {@code Map<String, Object>} trees produced by
 * Jackson. Drivers read them through this view so that a missing key, a
 * {@code null} value or a value of an unexpected type never raises: each
 * accessor simply reports absence.
 * </p>
 *
 * <h3>String accessors</h3>
 * <ul>
 * <li>{@link #string(String)} returns any non-null value as text, including
 * the empty string.</li>
 * <li>{@link #text(String)} additionally treats the empty string as absent,
 * which is what fallback chains ("this field, else that field") want.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PayloadView {

    private static final PayloadView EMPTY = new PayloadView(Collections.emptyMap());

    private final Map<String, Object> fields;

    private PayloadView(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Wrap a value. Anything that is not a map yields an empty view; map keys
     * are taken by their string form.
     */
    public static PayloadView of(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            map.forEach((k, v) -> fields.put(String.valueOf(k), v));
            return new PayloadView(fields);
        }
        return EMPTY;
    }

    public static PayloadView empty() {
        return EMPTY;
    }

    /**
     * @return the wrapped map (unmodifiable)
     */
    public Map<String, Object> raw() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    // ---------------------------------------------------------------
    // Presence
    // ---------------------------------------------------------------

    /**
     * @return {@code true} if the key is present, even with a {@code null} value
     */
    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * @return number of the given keys that are present
     */
    public int countPresent(String... keys) {
        int count = 0;
        for (String key : keys) {
            if (fields.containsKey(key)) {
                count++;
            }
        }
        return count;
    }

    public boolean hasAny(String... keys) {
        return countPresent(keys) > 0;
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public Optional<Object> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Optional<String> string(String key) {
        Object raw = fields.get(key);
        return raw == null ? Optional.empty() : Optional.of(asText(raw));
    }

    public String string(String key, String defaultValue) {
        return string(key).orElse(defaultValue);
    }

    /**
     * @return the value as text, empty when missing, {@code null} or blank-empty
     */
    public Optional<String> text(String key) {
        return string(key).filter(s -> !s.isEmpty());
    }

    /**
     * @return the first non-empty text value among {@code keys}
     */
    public Optional<String> firstText(String... keys) {
        for (String key : keys) {
            Optional<String> value = text(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * @return the first value among {@code keys} that is non-null and not an empty string
     */
    public Optional<Object> firstValue(String... keys) {
        for (String key : keys) {
            Object raw = fields.get(key);
            if (raw != null && !"".equals(raw)) {
                return Optional.of(raw);
            }
        }
        return Optional.empty();
    }

    public boolean isObject(String key) {
        return fields.get(key) instanceof Map<?, ?>;
    }

    public boolean isList(String key) {
        return fields.get(key) instanceof List<?>;
    }

    /**
     * @return nested object view, empty view when missing or not an object
     */
    public PayloadView object(String key) {
        return of(fields.get(key));
    }

    public List<Object> list(String key) {
        Object raw = fields.get(key);
        if (raw instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return List.of();
    }

    /**
     * @return the object elements of a list value, non-object elements skipped
     */
    public List<PayloadView> objects(String key) {
        List<PayloadView> views = new ArrayList<>();
        for (Object element : list(key)) {
            if (element instanceof Map<?, ?>) {
                views.add(of(element));
            }
        }
        return views;
    }

    /**
     * Read a nested object as a string-to-string map. {@code null} values are
     * dropped, every other value is converted to text.
     */
    public Map<String, String> stringMap(String key) {
        Map<String, String> result = new LinkedHashMap<>();
        if (fields.get(key) instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null && v != null) {
                    result.put(k.toString(), asText(v));
                }
            });
        }
        return result;
    }

    public Optional<Double> number(String key) {
        Object raw = fields.get(key);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Render a JSON scalar as text. Integral doubles print without a fraction.
     */
    static String asText(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)
                && Math.abs(d) < 1e15) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return "PayloadView" + fields.keySet();
    }
}
