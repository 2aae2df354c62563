package io.taintscan.model;

import java.util.Locale;

/**
 * Verdict for a single source-to-sink path, in ascending order of severity.
 */
public enum PathVerdict {
    /**
     * Not live: an unregistered entry point or a statically never-taken edge.
     */
    DEAD,

    /**
     * Live, and a sanitizer or strict validator precedes the sink.
     */
    SANITIZED,

    /**
     * Live, unsanitized, and an authorization gate precedes the sink.
     */
    AUTH_PROTECTED,

    /**
     * Live, and only a weak validator precedes the sink. Still exploitable.
     */
    PARTIALLY_MITIGATED,

    /**
     * Live, and nothing protective precedes the sink.
     */
    VULNERABLE;

    public boolean isLive() {
        return this != DEAD;
    }

    /**
     * Returns true if an attacker can still reach the sink with tainted data.
     */
    public boolean isExploitable() {
        return this == VULNERABLE || this == PARTIALLY_MITIGATED;
    }

    /**
     * Returns the display label, e.g. {@code "partially mitigated"}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
