package com.rockpoint.payments.adapters;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant readers for gateway response bodies.
 */
final class JsonFields {

    private JsonFields() {}

    static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** Integer value of a numeric or numeric-string field, null when absent or not a number. */
    static Integer integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static boolean flag(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.asBoolean(false);
    }

    static String unexpected(int httpStatus) {
        return "Unexpected response from gateway (HTTP " + httpStatus + ")";
    }

    static boolean is2xx(int httpStatus) {
        return httpStatus >= 200 && httpStatus < 300;
    }
}
