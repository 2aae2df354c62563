package io.taintscan.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Policy knobs for turning path evidence into verdicts.
 * <p>
 * The boundary between "partially mitigated" and "benign" is a judgment about real-world
 * exploitability, so it lives here rather than in the engine. Loaded from YAML; the bundled
 * {@code /taint-policy.yaml} provides the defaults and a user file overrides individual keys.
 */
public class ClassificationPolicy {

    private static final String DEFAULT_CONFIG = "/taint-policy.yaml";

    static final String WEAK_VALIDATOR_MITIGATES = "weakValidatorMitigates";
    static final String AUTH_GATE_IS_BENIGN = "authGateIsBenign";
    static final String MATCH_PROTECTED_CATEGORY = "matchProtectedCategory";
    static final String MAX_PATHS_PER_SINK = "maxPathsPerSink";
    static final String ORPHANED_SINKS = "orphanedSinks";

    private static final Set<String> KNOWN_KEYS = Set.of(
            WEAK_VALIDATOR_MITIGATES,
            AUTH_GATE_IS_BENIGN,
            MATCH_PROTECTED_CATEGORY,
            MAX_PATHS_PER_SINK,
            ORPHANED_SINKS
    );

    /**
     * What to do with sinks no other node has an edge into.
     */
    public enum OrphanHandling {
        EXCLUDE,
        FAIL
    }

    private final boolean weakValidatorMitigates;
    private final boolean authGateIsBenign;
    private final boolean matchProtectedCategory;
    private final int maxPathsPerSink;
    private final OrphanHandling orphanedSinks;
    private final Set<String> declaredKeys;

    private ClassificationPolicy(Builder builder) {
        this.weakValidatorMitigates = builder.weakValidatorMitigates;
        this.authGateIsBenign = builder.authGateIsBenign;
        this.matchProtectedCategory = builder.matchProtectedCategory;
        this.maxPathsPerSink = builder.maxPathsPerSink;
        this.orphanedSinks = builder.orphanedSinks;
        this.declaredKeys = Collections.unmodifiableSet(new LinkedHashSet<>(builder.declaredKeys));
        if (maxPathsPerSink < 1) {
            throw new IllegalArgumentException(MAX_PATHS_PER_SINK + " must be positive: " + maxPathsPerSink);
        }
    }

    /**
     * Returns the built-in policy without reading any file.
     */
    public static ClassificationPolicy defaults() {
        return builder().build();
    }

    /**
     * Loads the bundled default policy from the classpath.
     */
    public static ClassificationPolicy loadDefault() {
        try (InputStream is = ClassificationPolicy.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default policy not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default policy", e);
        }
    }

    /**
     * Loads a policy file and merges it over the bundled defaults.
     */
    public static ClassificationPolicy loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return loadDefault().merge(load(is));
        }
    }

    /**
     * Loads a policy from YAML. Keys that are absent keep their built-in values.
     *
     * @throws IOException if the YAML is malformed, names an unknown key, or has an ill-typed value
     */
    public static ClassificationPolicy load(InputStream is) throws IOException {
        Object document;
        try {
            document = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new IOException("Invalid policy YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IOException("Policy must be a YAML mapping");
        }

        Builder builder = builder();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (!KNOWN_KEYS.contains(key)) {
                throw new IOException("Unknown policy key: " + key);
            }
            switch (key) {
                case WEAK_VALIDATOR_MITIGATES -> builder.weakValidatorMitigates(requireBoolean(key, value));
                case AUTH_GATE_IS_BENIGN -> builder.authGateIsBenign(requireBoolean(key, value));
                case MATCH_PROTECTED_CATEGORY -> builder.matchProtectedCategory(requireBoolean(key, value));
                case MAX_PATHS_PER_SINK -> builder.maxPathsPerSink(requirePositiveInt(key, value));
                case ORPHANED_SINKS -> builder.orphanedSinks(requireOrphanHandling(key, value));
                default -> throw new IOException("Unknown policy key: " + key);
            }
        }
        return builder.build();
    }

    private static boolean requireBoolean(String key, Object value) throws IOException {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IOException("Policy key '" + key + "' must be true or false, got: " + value);
    }

    private static int requirePositiveInt(String key, Object value) throws IOException {
        if (value instanceof Integer i && i > 0) {
            return i;
        }
        throw new IOException("Policy key '" + key + "' must be a positive integer, got: " + value);
    }

    private static OrphanHandling requireOrphanHandling(String key, Object value) throws IOException {
        String message = "Policy key '" + key + "' must be 'exclude' or 'fail', got: " + value;
        if (!(value instanceof String s)) {
            throw new IOException(message);
        }
        try {
            return OrphanHandling.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IOException(message, e);
        }
    }

    /**
     * Merges this policy with another, with keys declared by the other taking precedence.
     */
    public ClassificationPolicy merge(ClassificationPolicy other) {
        Builder merged = toBuilder();
        Set<String> keys = other.declaredKeys;
        if (keys.contains(WEAK_VALIDATOR_MITIGATES)) {
            merged.weakValidatorMitigates(other.weakValidatorMitigates);
        }
        if (keys.contains(AUTH_GATE_IS_BENIGN)) {
            merged.authGateIsBenign(other.authGateIsBenign);
        }
        if (keys.contains(MATCH_PROTECTED_CATEGORY)) {
            merged.matchProtectedCategory(other.matchProtectedCategory);
        }
        if (keys.contains(MAX_PATHS_PER_SINK)) {
            merged.maxPathsPerSink(other.maxPathsPerSink);
        }
        if (keys.contains(ORPHANED_SINKS)) {
            merged.orphanedSinks(other.orphanedSinks);
        }
        return merged.build();
    }

    /**
     * Whether a weak validator downgrades an otherwise vulnerable path to partially mitigated.
     */
    public boolean weakValidatorMitigates() {
        return weakValidatorMitigates;
    }

    /**
     * Whether a live path behind an authorization gate counts as benign.
     */
    public boolean authGateIsBenign() {
        return authGateIsBenign;
    }

    /**
     * Whether a sanitizer's declared {@code protects} categories must include the sink's category.
     */
    public boolean matchProtectedCategory() {
        return matchProtectedCategory;
    }

    public int maxPathsPerSink() {
        return maxPathsPerSink;
    }

    public OrphanHandling orphanedSinks() {
        return orphanedSinks;
    }

    public Set<String> declaredKeys() {
        return declaredKeys;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.weakValidatorMitigates = weakValidatorMitigates;
        builder.authGateIsBenign = authGateIsBenign;
        builder.matchProtectedCategory = matchProtectedCategory;
        builder.maxPathsPerSink = maxPathsPerSink;
        builder.orphanedSinks = orphanedSinks;
        builder.declaredKeys.addAll(declaredKeys);
        return builder;
    }

    @Override
    public String toString() {
        return "ClassificationPolicy{" +
                WEAK_VALIDATOR_MITIGATES + "=" + weakValidatorMitigates +
                ", " + AUTH_GATE_IS_BENIGN + "=" + authGateIsBenign +
                ", " + MATCH_PROTECTED_CATEGORY + "=" + matchProtectedCategory +
                ", " + MAX_PATHS_PER_SINK + "=" + maxPathsPerSink +
                ", " + ORPHANED_SINKS + "=" + orphanedSinks +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean weakValidatorMitigates = true;
        private boolean authGateIsBenign = true;
        private boolean matchProtectedCategory = false;
        private int maxPathsPerSink = 10_000;
        private OrphanHandling orphanedSinks = OrphanHandling.EXCLUDE;
        private final Set<String> declaredKeys = new LinkedHashSet<>();

        public Builder weakValidatorMitigates(boolean value) {
            this.weakValidatorMitigates = value;
            declaredKeys.add(WEAK_VALIDATOR_MITIGATES);
            return this;
        }

        public Builder authGateIsBenign(boolean value) {
            this.authGateIsBenign = value;
            declaredKeys.add(AUTH_GATE_IS_BENIGN);
            return this;
        }

        public Builder matchProtectedCategory(boolean value) {
            this.matchProtectedCategory = value;
            declaredKeys.add(MATCH_PROTECTED_CATEGORY);
            return this;
        }

        public Builder maxPathsPerSink(int value) {
            this.maxPathsPerSink = value;
            declaredKeys.add(MAX_PATHS_PER_SINK);
            return this;
        }

        public Builder orphanedSinks(OrphanHandling value) {
            this.orphanedSinks = value;
            declaredKeys.add(ORPHANED_SINKS);
            return this;
        }

        public ClassificationPolicy build() {
            return new ClassificationPolicy(this);
        }
    }
}
