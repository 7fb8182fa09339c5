package com.sprintsync.workflow.service;

import java.util.regex.Pattern;

/**
 * Input-shape checks shared by the services. Violations are caller mistakes,
 * reported as {@link IllegalArgumentException} (HTTP 400).
 */
final class Validation {

    private static final Pattern HEX_COLOR = Pattern.compile("^#(?:[0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    private Validation() {}

    /** Trimmed value, or IllegalArgumentException if null or blank. */
    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    /** Null is allowed (no color); anything else must be #RGB or #RRGGBB. */
    static String checkColor(String color) {
        if (color != null && !HEX_COLOR.matcher(color).matches()) {
            throw new IllegalArgumentException("color must be a hex string like #3B82F6, got '" + color + "'");
        }
        return color;
    }
}
