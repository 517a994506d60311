package com.visual.vgc.codegen;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Output pin id to the source expression holding its value, plus the set of
 * local names already taken in the entry method.
 */
final class SymbolTable {
    private final Map<UUID, String> expressions = new HashMap<>();
    private final Set<String> names = new HashSet<>();

    void reserve(String name) {
        names.add(name);
    }

    /** Returns {@code base}, or {@code base_1}, {@code base_2}, ... if taken. Reserves the result. */
    String uniqueName(String base) {
        if (names.add(base))
            return base;
        for (int i = 1;; i++) {
            String candidate = base + "_" + i;
            if (names.add(candidate))
                return candidate;
        }
    }

    void register(UUID pinId, String expression) {
        expressions.put(pinId, expression);
    }

    void unregister(UUID pinId) {
        expressions.remove(pinId);
    }

    /** The registered expression, or null. */
    String lookup(UUID pinId) {
        return expressions.get(pinId);
    }
}
