package io.taintscan.model;

import java.util.Set;

/**
 * The role the classifier assigned to one node.
 *
 * @param role     Semantic role
 * @param strength Validator strength ({@link ValidatorStrength#NONE} for non-validators)
 * @param protects Categories a sanitizer or validator declares it protects; empty means unrestricted
 */
public record RoleAssignment(
        Role role,
        ValidatorStrength strength,
        Set<SinkCategory> protects
) {
    public static final RoleAssignment NONE = new RoleAssignment(Role.NONE, ValidatorStrength.NONE, Set.of());

    public RoleAssignment {
        if (role == null) {
            role = Role.NONE;
        }
        if (strength == null) {
            strength = ValidatorStrength.NONE;
        }
        protects = protects == null ? Set.of() : Set.copyOf(protects);
    }

    public static RoleAssignment of(Role role) {
        return new RoleAssignment(role, ValidatorStrength.NONE, Set.of());
    }

    /**
     * Returns true if this node neutralizes taint: a sanitizer or a strict validator.
     */
    public boolean isNeutralizing() {
        return role == Role.SANITIZER
                || (role == Role.VALIDATOR && strength == ValidatorStrength.STRICT);
    }

    /**
     * Returns true if this node is a weak validator.
     */
    public boolean isWeakValidator() {
        return role == Role.VALIDATOR && strength == ValidatorStrength.WEAK;
    }

    /**
     * Returns true if this node's protection applies to the given sink category.
     */
    public boolean covers(SinkCategory category) {
        return protects.isEmpty() || protects.contains(category);
    }
}
