package com.medimax.assistant.agent;

import com.medimax.assistant.exception.ArgumentValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks model-supplied arguments against a tool's {@link ArgumentSchema} and
 * coerces them to canonical Java types.
 *
 * <ul>
 *   <li>{@code INTEGER} becomes {@link Long}; numeric strings and integral doubles are accepted</li>
 *   <li>{@code NUMBER} becomes {@link Double}</li>
 *   <li>{@code BOOLEAN} accepts booleans and the strings {@code "true"} / {@code "false"}</li>
 *   <li>{@code STRING} accepts any scalar; allowed values match ignoring case and are replaced by their declared spelling</li>
 * </ul>
 *
 * Fields not declared in the schema are dropped.
 */
public final class ArgumentValidator {

    private ArgumentValidator() {
    }

    public static Map<String, Object> validate(String toolName, ArgumentSchema schema, Map<String, Object> arguments) {
        Map<String, Object> input = arguments == null ? Map.of() : arguments;
        Map<String, Object> validated = new LinkedHashMap<>();

        for (Map.Entry<String, ArgumentSpec> field : schema.getFields().entrySet()) {
            String name = field.getKey();
            ArgumentSpec spec = field.getValue();
            Object raw = input.get(name);

            if (raw == null) {
                if (spec.isRequired()) {
                    throw new ArgumentValidationException(toolName, name, "is required");
                }
                continue;
            }
            validated.put(name, coerce(toolName, name, spec, raw));
        }
        return validated;
    }

    private static Object coerce(String toolName, String field, ArgumentSpec spec, Object raw) {
        return switch (spec.getType()) {
            case INTEGER -> checkRange(toolName, field, spec, toLong(toolName, field, raw));
            case NUMBER -> checkRange(toolName, field, spec, toDouble(toolName, field, raw));
            case BOOLEAN -> toBoolean(toolName, field, raw);
            case STRING -> checkString(toolName, field, spec, toText(toolName, field, raw));
            case OBJECT -> {
                if (!(raw instanceof Map<?, ?>)) {
                    throw new ArgumentValidationException(toolName, field, "must be an object");
                }
                yield raw;
            }
        };
    }

    private static Long toLong(String toolName, String field, Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big) {
            return exactLong(toolName, field, new BigDecimal(big));
        }
        if (raw instanceof BigDecimal decimal) {
            return exactLong(toolName, field, decimal);
        }
        if (raw instanceof Number number) {
            return integral(toolName, field, number.doubleValue());
        }
        if (raw instanceof String text) {
            try {
                return exactLong(toolName, field, new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                throw new ArgumentValidationException(toolName, field, "must be an integer, got '" + text + "'");
            }
        }
        throw new ArgumentValidationException(toolName, field, "must be an integer");
    }

    private static long exactLong(String toolName, String field, BigDecimal value) {
        if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
            throw new ArgumentValidationException(toolName, field, "must be an integer, got " + value.toPlainString());
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new ArgumentValidationException(toolName, field, "is outside the 64-bit integer range");
        }
    }

    private static long integral(String toolName, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new ArgumentValidationException(toolName, field, "must be an integer, got " + value);
        }
        if (value < Long.MIN_VALUE || value >= Long.MAX_VALUE) {
            throw new ArgumentValidationException(toolName, field, "is outside the 64-bit integer range");
        }
        return (long) value;
    }

    private static Double toDouble(String toolName, String field, Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new ArgumentValidationException(toolName, field, "must be a number, got '" + text + "'");
            }
        }
        throw new ArgumentValidationException(toolName, field, "must be a number");
    }

    private static Boolean toBoolean(String toolName, String field, Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Boolean.FALSE;
            }
        }
        throw new ArgumentValidationException(toolName, field, "must be a boolean");
    }

    private static String toText(String toolName, String field, Object raw) {
        if (raw instanceof String || raw instanceof Number || raw instanceof Boolean) {
            return raw.toString();
        }
        throw new ArgumentValidationException(toolName, field, "must be a string");
    }

    private static <T extends Number> T checkRange(String toolName, String field, ArgumentSpec spec, T value) {
        double numeric = value.doubleValue();
        if (spec.getMin() != null && numeric < spec.getMin()) {
            throw new ArgumentValidationException(toolName, field, "must be >= " + format(spec.getMin()) + ", got " + value);
        }
        if (spec.getMax() != null && numeric > spec.getMax()) {
            throw new ArgumentValidationException(toolName, field, "must be <= " + format(spec.getMax()) + ", got " + value);
        }
        return value;
    }

    private static String checkString(String toolName, String field, ArgumentSpec spec, String value) {
        if (spec.getMaxLength() != null && value.length() > spec.getMaxLength()) {
            throw new ArgumentValidationException(toolName, field,
                "must be at most " + spec.getMaxLength() + " characters, got " + value.length());
        }
        if (spec.getAllowedValues().isEmpty()) {
            return value;
        }
        return spec.getAllowedValues().stream()
            .filter(allowed -> allowed.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new ArgumentValidationException(toolName, field,
                "must be one of " + spec.getAllowedValues() + ", got '" + value + "'"));
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
