package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for model and provider JSON, where numbers sometimes arrive as strings
 * ("₹1,499") and booleans as "yes"/"no".
 */
final class JsonNodes {

    private static final Pattern NUMBER = Pattern.compile("\\d[\\d,]*(\\.\\d+)?");

    private JsonNodes() {
    }

    static String textOrNull(JsonNode node) {
        if (node != null && (node.isTextual() || node.isNumber())) {
            String text = node.asText().trim();
            if (!text.isEmpty() && !text.equalsIgnoreCase("null")) {
                return text;
            }
        }
        return null;
    }

    static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            Matcher matcher = NUMBER.matcher(node.asText());
            if (!matcher.find()) {
                return null;
            }
            return new BigDecimal(matcher.group().replace(",", ""));
        }
        return null;
    }

    static Boolean booleanOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim().toLowerCase();
            if (text.equals("true") || text.equals("yes")) {
                return Boolean.TRUE;
            }
            if (text.equals("false") || text.equals("no")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    static Double doubleOrNull(JsonNode node) {
        BigDecimal value = decimalOrNull(node);
        return value != null ? value.doubleValue() : null;
    }

    static Integer intOrNull(JsonNode node) {
        BigDecimal value = decimalOrNull(node);
        return value != null ? value.intValue() : null;
    }

    static List<String> readArray(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String text = textOrNull(item);
                if (text != null) {
                    values.add(text);
                }
            });
        } else {
            String text = textOrNull(node);
            if (text != null) {
                values.add(text);
            }
        }
        return List.copyOf(values);
    }
}
