package io.taintscan.analysis;

import io.taintscan.config.ClassificationPolicy;
import io.taintscan.graph.Node;
import io.taintscan.model.PathClassification;
import io.taintscan.model.PathVerdict;
import io.taintscan.model.RoleAssignment;
import io.taintscan.model.SinkCategory;
import io.taintscan.model.TaintPath;

import java.util.List;
import java.util.OptionalInt;

/**
 * Folds one path into a single verdict.
 * <p>
 * Precedence, first match wins:
 * <ol>
 *   <li>not live: {@link PathVerdict#DEAD}</li>
 *   <li>a sanitizer or strict validator anywhere before the sink: {@link PathVerdict#SANITIZED}</li>
 *   <li>an authorization gate before the sink: {@link PathVerdict#AUTH_PROTECTED}</li>
 *   <li>a weak validator before the sink: {@link PathVerdict#PARTIALLY_MITIGATED}</li>
 *   <li>otherwise {@link PathVerdict#VULNERABLE}</li>
 * </ol>
 * Sanitization outranks authorization because it is a data-level guarantee; a gate seen on a
 * sanitized path is kept as evidence.
 */
public class PathVerdictEngine {

    private final NodeRoles roles;
    private final ClassificationPolicy policy;

    public PathVerdictEngine(NodeRoles roles, ClassificationPolicy policy) {
        this.roles = roles;
        this.policy = policy;
    }

    /**
     * Classifies a path ending at a sink.
     */
    public PathClassification classify(TaintPath path) {
        PathClassification.Builder result = PathClassification.builder(path);
        SinkCategory category = roles.sinkCategory(path.sink().id());

        String protectedBy = null;
        boolean authGateSeen = false;
        boolean weakValidatorSeen = false;

        // Every node before the sink; the sink's own tags never protect it.
        List<Node> nodes = path.nodes();
        for (int i = 0; i < nodes.size() - 1; i++) {
            String id = nodes.get(i).id();
            RoleAssignment assignment = roles.of(id);
            switch (assignment.role()) {
                case AUTHZ_GATE -> {
                    authGateSeen = true;
                    result.addAuthzGate(id);
                }
                case RATE_LIMITER -> result.addRateLimiter(id);
                case DEAD_GUARD -> result.addDeadGuard(id);
                default -> {
                    // sanitizers and validators are checked below
                }
            }
            if (assignment.isWeakValidator()) {
                weakValidatorSeen = true;
                result.addWeakValidator(id);
            }
            if (protectedBy == null && neutralizes(assignment, category)) {
                protectedBy = id;
            }
        }

        if (!path.isLive()) {
            return result.verdict(PathVerdict.DEAD)
                    .deadReason(deadReason(path))
                    .build();
        }

        result.authGateSeen(authGateSeen);

        if (protectedBy != null) {
            return result.verdict(PathVerdict.SANITIZED).protectedBy(protectedBy).build();
        }
        if (authGateSeen) {
            return result.verdict(PathVerdict.AUTH_PROTECTED).build();
        }
        if (weakValidatorSeen && policy.weakValidatorMitigates()) {
            return result.verdict(PathVerdict.PARTIALLY_MITIGATED).build();
        }
        return result.verdict(PathVerdict.VULNERABLE).build();
    }

    private boolean neutralizes(RoleAssignment assignment, SinkCategory category) {
        if (!assignment.isNeutralizing()) {
            return false;
        }
        return !policy.matchProtectedCategory() || assignment.covers(category);
    }

    private String deadReason(TaintPath path) {
        Node entry = path.entry();
        if (!path.entryRegistered()) {
            return entry.isEntryPoint()
                    ? "entry point " + entry.id() + " is not registered"
                    : entry.id() + " is not an entry point and no entry point calls it";
        }
        OptionalInt never = path.firstNeverEdge();
        if (never.isPresent()) {
            int i = never.getAsInt();
            return "edge " + path.nodes().get(i).id() + " -> " + path.nodes().get(i + 1).id()
                    + " is never taken";
        }
        return "path is not live";
    }
}
