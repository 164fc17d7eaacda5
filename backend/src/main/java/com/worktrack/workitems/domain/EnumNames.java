package com.worktrack.workitems.domain;

import java.util.Locale;

/**
 * Lenient enum lookup shared by the JSON and query-parameter bindings.
 * Accepts the constant name in any case and the PascalCase form without
 * underscores, so {@code IN_PROGRESS}, {@code in_progress} and
 * {@code InProgress} all resolve to the same constant.
 */
final class EnumNames {

    private EnumNames() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type.getSimpleName() + " must not be blank");
        }
        String wanted = normalize(value);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value.trim());
    }

    private static String normalize(String value) {
        return value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
