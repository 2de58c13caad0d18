package io.github.cyfko.wilkinson.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A variable of the formula with everything attached to it.
 * <p>
 * {@link #role()} is the role of the first appearance. A variable used in several
 * structural positions lists every role it plays in {@link #roles()}, first-seen first.
 * </p>
 *
 * @param id               1-based id; responses first, then first-appearance order
 * @param name             identifier as written
 * @param role             role at first registration
 * @param roles            every distinct role, in first-seen order
 * @param generatedColumns columns attributed to this variable
 * @param transformations  functions applied to this variable
 * @param interactions     labels of the interaction terms the variable takes part in
 * @param randomEffects    group-level memberships
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(
    int id,
    String name,
    VariableRole role,
    List<VariableRole> roles,
    List<String> generatedColumns,
    List<Transformation> transformations,
    List<String> interactions,
    List<RandomEffectInfo> randomEffects
) {

    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
        roles = List.copyOf(roles);
        generatedColumns = List.copyOf(generatedColumns);
        transformations = List.copyOf(transformations);
        interactions = List.copyOf(interactions);
        randomEffects = List.copyOf(randomEffects);
    }

    public boolean hasRole(VariableRole candidate) {
        return roles.contains(candidate);
    }
}
