package io.taintscan.analysis;

import io.taintscan.model.AnalysisWarning;
import io.taintscan.model.Role;
import io.taintscan.model.RoleAssignment;
import io.taintscan.model.SinkCategory;

import java.util.List;
import java.util.Map;

/**
 * Role of every node in a graph, computed once by {@link NodeClassifier} and shared read-only
 * by all sink workers.
 *
 * @param assignments    Node id to assigned role
 * @param sinkCategories Sink id to declared category
 * @param warnings       Tags that could not be classified, in node declaration order
 */
public record NodeRoles(
        Map<String, RoleAssignment> assignments,
        Map<String, SinkCategory> sinkCategories,
        List<AnalysisWarning> warnings
) {
    public NodeRoles {
        assignments = Map.copyOf(assignments);
        sinkCategories = Map.copyOf(sinkCategories);
        warnings = List.copyOf(warnings);
    }

    /**
     * Returns the assignment for a node; unknown nodes have no role.
     */
    public RoleAssignment of(String nodeId) {
        return assignments.getOrDefault(nodeId, RoleAssignment.NONE);
    }

    public Role roleOf(String nodeId) {
        return of(nodeId).role();
    }

    public SinkCategory sinkCategory(String sinkId) {
        return sinkCategories.getOrDefault(sinkId, SinkCategory.OTHER);
    }
}
