package io.taintscan.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The verdict for one path together with the evidence that produced it.
 *
 * @param path           The classified path
 * @param verdict        Path verdict
 * @param authGateSeen   Whether an authorization gate lies on the (live) path, kept even when the
 *                       verdict is {@link PathVerdict#SANITIZED}
 * @param protectedBy    Id of the first neutralizing node, or null
 * @param authzGates     Ids of authorization gates on the path
 * @param weakValidators Ids of weak validators on the path
 * @param rateLimiters   Ids of rate limiters on the path
 * @param deadGuards     Ids of dead guards on the path
 * @param deadReason     Why the path is dead, or null if it is live
 */
public record PathClassification(
        TaintPath path,
        PathVerdict verdict,
        boolean authGateSeen,
        String protectedBy,
        List<String> authzGates,
        List<String> weakValidators,
        List<String> rateLimiters,
        List<String> deadGuards,
        String deadReason
) {
    public PathClassification {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        authzGates = authzGates == null ? List.of() : List.copyOf(authzGates);
        weakValidators = weakValidators == null ? List.of() : List.copyOf(weakValidators);
        rateLimiters = rateLimiters == null ? List.of() : List.copyOf(rateLimiters);
        deadGuards = deadGuards == null ? List.of() : List.copyOf(deadGuards);
    }

    /**
     * Returns the evidence chain as display lines, most decisive first.
     */
    public List<String> evidence() {
        List<String> lines = new ArrayList<>();
        if (deadReason != null) {
            lines.add(deadReason);
        }
        if (protectedBy != null) {
            lines.add("taint neutralized by " + protectedBy);
        }
        for (String gate : authzGates) {
            lines.add("authorization gate " + gate);
        }
        for (String validator : weakValidators) {
            lines.add("weak validator " + validator);
        }
        for (String limiter : rateLimiters) {
            lines.add("rate limiter " + limiter);
        }
        for (String guard : deadGuards) {
            lines.add("dead guard " + guard);
        }
        for (CycleTruncation truncation : path.truncations()) {
            lines.add(truncation.formatted());
        }
        return lines;
    }

    public static Builder builder(TaintPath path) {
        return new Builder(path);
    }

    public static class Builder {
        private final TaintPath path;
        private PathVerdict verdict;
        private boolean authGateSeen;
        private String protectedBy;
        private final List<String> authzGates = new ArrayList<>();
        private final List<String> weakValidators = new ArrayList<>();
        private final List<String> rateLimiters = new ArrayList<>();
        private final List<String> deadGuards = new ArrayList<>();
        private String deadReason;

        private Builder(TaintPath path) {
            this.path = path;
        }

        public Builder verdict(PathVerdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder authGateSeen(boolean authGateSeen) {
            this.authGateSeen = authGateSeen;
            return this;
        }

        public Builder protectedBy(String nodeId) {
            this.protectedBy = nodeId;
            return this;
        }

        public Builder addAuthzGate(String nodeId) {
            this.authzGates.add(nodeId);
            return this;
        }

        public Builder addWeakValidator(String nodeId) {
            this.weakValidators.add(nodeId);
            return this;
        }

        public Builder addRateLimiter(String nodeId) {
            this.rateLimiters.add(nodeId);
            return this;
        }

        public Builder addDeadGuard(String nodeId) {
            this.deadGuards.add(nodeId);
            return this;
        }

        public Builder deadReason(String deadReason) {
            this.deadReason = deadReason;
            return this;
        }

        public PathClassification build() {
            return new PathClassification(
                    path,
                    verdict,
                    authGateSeen,
                    protectedBy,
                    authzGates,
                    weakValidators,
                    rateLimiters,
                    deadGuards,
                    deadReason
            );
        }
    }
}
