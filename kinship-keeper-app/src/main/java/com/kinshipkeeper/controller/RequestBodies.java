package com.kinshipkeeper.controller;

import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.service.RejectionException;

import java.util.Map;

/**
 * Field readers for the loosely typed JSON bodies the API accepts.
 */
final class RequestBodies {

    private RequestBodies() {
    }

    static Long id(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new RejectionException(Rejection.INVALID_PARAMETER, key + " must be a number");
        }
        return number.longValue();
    }

    static String text(Map<String, Object> body, String key) {
        Object value = body.get(key);
        return value instanceof String s ? s : null;
    }

    /**
     * Parse an optional integer query parameter; anything non-numeric is a rejection, not a 500.
     */
    static Integer intParam(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new RejectionException(Rejection.INVALID_PARAMETER, "Invalid " + name + " parameter: " + raw);
        }
    }
}
