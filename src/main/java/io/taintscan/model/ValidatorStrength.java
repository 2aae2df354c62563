package io.taintscan.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How thoroughly a validator constrains its input.
 */
public enum ValidatorStrength {
    /**
     * Full-value allowlist or pattern match. Neutralizes taint.
     */
    STRICT,

    /**
     * Substring or blacklist check. Mitigates but does not neutralize taint.
     */
    WEAK,

    /**
     * No effective constraint.
     */
    NONE;

    public static Optional<ValidatorStrength> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> Optional.of(STRICT);
            case "weak" -> Optional.of(WEAK);
            case "none" -> Optional.of(NONE);
            default -> Optional.empty();
        };
    }
}
