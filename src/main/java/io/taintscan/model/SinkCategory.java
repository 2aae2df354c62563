package io.taintscan.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of vulnerability a sink exposes, and the kind a sanitizer protects against.
 */
public enum SinkCategory {
    SQL,
    TEMPLATE,
    OTHER;

    /**
     * Parses a category tag such as {@code sql}, {@code sql-injection} or {@code template}.
     *
     * @return the category, or empty if the value is not recognised
     */
    public static Optional<SinkCategory> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sql", "sqli", "sql-injection", "sql_injection" -> Optional.of(SQL);
            case "template", "ssti", "template-injection", "template_injection" -> Optional.of(TEMPLATE);
            case "other" -> Optional.of(OTHER);
            default -> Optional.empty();
        };
    }
}
