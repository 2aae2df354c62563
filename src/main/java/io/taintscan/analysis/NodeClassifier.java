package io.taintscan.analysis;

import io.taintscan.graph.Node;
import io.taintscan.graph.TaintGraph;
import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.Role;
import io.taintscan.model.RoleAssignment;
import io.taintscan.model.SinkCategory;
import io.taintscan.model.ValidatorStrength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns each node its semantic role from declared tags.
 * <p>
 * Classification is a pure function of the tags. Node ids and labels are never consulted: a
 * function named {@code validated_query} is a plain call unless it is tagged otherwise.
 * Anything that cannot be classified fails closed, i.e. it is given no protective effect and
 * reported as a warning.
 */
public class NodeClassifier {

    private static final Logger log = LoggerFactory.getLogger(NodeClassifier.class);

    /**
     * Result of classifying one node.
     *
     * @param assignment Assigned role
     * @param warnings   Problems with the node's tags
     */
    public record Result(RoleAssignment assignment, List<AnalysisWarning> warnings) {
        public Result {
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Returns the role of a node.
     */
    public Role classify(Node node) {
        return assign(node).assignment().role();
    }

    /**
     * Classifies a node, reporting any tag that could not be interpreted.
     */
    public Result assign(Node node) {
        List<AnalysisWarning> warnings = new ArrayList<>();

        Optional<String> roleTag = node.tag(Node.TAG_ROLE);
        if (roleTag.isEmpty()) {
            return new Result(RoleAssignment.NONE, warnings);
        }

        Optional<Role> parsed = Role.fromTag(roleTag.get());
        if (parsed.isEmpty()) {
            warnings.add(AnalysisWarning.unclassifiableRole(node.id(),
                    "unknown role '" + roleTag.get() + "', treated as none"));
            return new Result(RoleAssignment.NONE, warnings);
        }

        Role role = parsed.get();
        ValidatorStrength strength = ValidatorStrength.NONE;
        if (role == Role.VALIDATOR) {
            strength = validatorStrength(node, warnings);
        }

        Set<SinkCategory> protects = Set.of();
        if (role == Role.SANITIZER || role == Role.VALIDATOR) {
            protects = protectedCategories(node, warnings);
        }

        return new Result(new RoleAssignment(role, strength, protects), warnings);
    }

    private ValidatorStrength validatorStrength(Node node, List<AnalysisWarning> warnings) {
        Optional<String> tag = node.tag(Node.TAG_STRENGTH);
        if (tag.isEmpty()) {
            warnings.add(AnalysisWarning.unclassifiableRole(node.id(),
                    "validator declares no strength, treated as none"));
            return ValidatorStrength.NONE;
        }
        Optional<ValidatorStrength> strength = ValidatorStrength.fromTag(tag.get());
        if (strength.isEmpty()) {
            warnings.add(AnalysisWarning.unclassifiableRole(node.id(),
                    "unknown validator strength '" + tag.get() + "', treated as none"));
            return ValidatorStrength.NONE;
        }
        return strength.get();
    }

    /**
     * Parses the comma-separated {@code protects} tag. An unrecognised category becomes
     * {@link SinkCategory#OTHER} so that it never widens what the node protects.
     */
    private Set<SinkCategory> protectedCategories(Node node, List<AnalysisWarning> warnings) {
        Optional<String> tag = node.tag(Node.TAG_PROTECTS);
        if (tag.isEmpty() || tag.get().isBlank()) {
            return Set.of();
        }
        Set<SinkCategory> categories = EnumSet.noneOf(SinkCategory.class);
        for (String value : tag.get().split(",")) {
            if (value.isBlank()) {
                continue;
            }
            Optional<SinkCategory> category = SinkCategory.fromTag(value);
            if (category.isPresent()) {
                categories.add(category.get());
            } else {
                warnings.add(AnalysisWarning.unclassifiableRole(node.id(),
                        "unknown protected category '" + value.trim() + "', treated as other"));
                categories.add(SinkCategory.OTHER);
            }
        }
        return categories;
    }

    /**
     * Returns the vulnerability category declared on a sink; undeclared means other.
     */
    public SinkCategory sinkCategory(Node sink) {
        return sink.tag(Node.TAG_SINK)
                .flatMap(SinkCategory::fromTag)
                .orElse(SinkCategory.OTHER);
    }

    /**
     * Classifies every node of the graph.
     */
    public NodeRoles classifyAll(TaintGraph graph) {
        Map<String, RoleAssignment> assignments = new HashMap<>();
        Map<String, SinkCategory> sinkCategories = new HashMap<>();
        List<AnalysisWarning> warnings = new ArrayList<>();

        for (Node node : graph.nodes()) {
            Result result = assign(node);
            assignments.put(node.id(), result.assignment());
            for (AnalysisWarning warning : result.warnings()) {
                log.warn("Node {}: {}", node.id(), warning.message());
                warnings.add(warning);
            }
            if (node.isSink()) {
                sinkCategories.put(node.id(), sinkCategory(node));
            }
        }

        log.debug("Classified {} nodes with {} warning(s)", assignments.size(), warnings.size());
        return new NodeRoles(assignments, sinkCategories, warnings);
    }
}
