package io.taintscan.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Semantic role of a node, derived from its declared {@code role} tag.
 */
public enum Role {
    NONE,
    SOURCE,
    SANITIZER,
    VALIDATOR,
    AUTHZ_GATE,
    RATE_LIMITER,
    DEAD_GUARD;

    /**
     * Parses a declared role tag. Case, hyphens, underscores and spaces are insignificant,
     * so {@code authz-gate}, {@code authzGate} and {@code AUTHZ_GATE} are the same role.
     *
     * @return the role, or empty if the tag names no known role
     */
    public static Optional<Role> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.toLowerCase(Locale.ROOT).replaceAll("[-_\\s]", "");
        return switch (key) {
            case "none", "plain", "plaincall" -> Optional.of(NONE);
            case "source" -> Optional.of(SOURCE);
            case "sanitizer" -> Optional.of(SANITIZER);
            case "validator" -> Optional.of(VALIDATOR);
            case "authzgate", "authgate" -> Optional.of(AUTHZ_GATE);
            case "ratelimiter" -> Optional.of(RATE_LIMITER);
            case "deadguard" -> Optional.of(DEAD_GUARD);
            default -> Optional.empty();
        };
    }
}
