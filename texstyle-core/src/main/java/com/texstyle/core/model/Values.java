package com.texstyle.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies option values so that no model object shares a mutable list with its caller.
 */
final class Values {

    private Values() {
        // utility class
    }

    /**
     * @param value option value
     * @return {@code value}, with lists (at any depth) replaced by unmodifiable copies
     */
    static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * @param options option name to value
     * @return unmodifiable, ordered copy with every value frozen
     */
    static Map<String, Object> freezeAll(Map<String, ?> options) {
        Map<String, Object> copy = new LinkedHashMap<>();
        options.forEach((key, value) -> copy.put(key, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }
}
