package com.alertrelay.pipeline.nodes;

import java.util.List;
import java.util.Map;

/**
 * Dot-path lookup over nested maps and lists, e.g.
 * {@code recommendations.0.title}.
 */
final class DotPaths {

    private DotPaths() {
        // utility class
    }

    /**
     * @return the value at {@code path}, or {@code null} when any segment is missing
     */
    static Object get(Object root, String path) {
        if (path == null || path.isBlank()) {
            return root;
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                current = element(list, segment);
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Object element(List<?> list, String segment) {
        try {
            int index = Integer.parseInt(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
