package com.medimax.assistant.model.clinical;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds and normalizes natural keys of clinical facts.
 *
 * <p>A key is made of one or more components joined by {@code |}. The first
 * component is mandatory; when it is blank the key is blank and the fact is
 * rejected during synthesis.
 */
public final class NaturalKeys {

    private static final String SEPARATOR = "|";

    private NaturalKeys() {
    }

    public static String condition(String name) {
        return compose(name);
    }

    public static String medication(String name, Object prescribedDate) {
        return compose(name, prescribedDate);
    }

    public static String encounter(Object date, String type) {
        return compose(date, type);
    }

    public static String symptom(String name) {
        return compose(name);
    }

    public static String labResult(String testName, Object date) {
        return compose(testName, date);
    }

    /**
     * Trimmed, lower-cased, inner whitespace collapsed. Blank input yields "".
     */
    public static String normalize(String key) {
        if (key == null) {
            return "";
        }
        return key.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String key) {
        return normalize(key).isEmpty();
    }

    private static String compose(Object first, Object... rest) {
        if (first == null || first.toString().isBlank()) {
            return "";
        }
        if (rest.length == 0) {
            return first.toString().trim();
        }
        return first.toString().trim() + SEPARATOR + Arrays.stream(rest)
            .map(part -> Objects.toString(part, "").trim())
            .collect(Collectors.joining(SEPARATOR));
    }
}
