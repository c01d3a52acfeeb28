package org.euler.convention;

import org.euler.model.AngleTriple;

import java.util.List;
import java.util.Objects;

/**
 * The resolved path from a convention up to its base (root) convention:
 * path().get(0) is the held convention, the last element is the root.
 * A base convention has a path of length 1.
 */
public final class ConventionChain {

    private final List<ConventionDescriptor> path;

    ConventionChain(List<ConventionDescriptor> path) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        if (!path.get(path.size() - 1).isBase()) {
            throw new IllegalArgumentException("path must end at a base convention");
        }
        this.path = List.copyOf(path);
    }

    public List<ConventionDescriptor> path() {
        return path;
    }

    public ConventionDescriptor held() {
        return path.get(0);
    }

    public ConventionDescriptor root() {
        return path.get(path.size() - 1);
    }

    public AxisCode rootCode() {
        return ((BaseDefinition) root().definition()).code();
    }

    /** Number of derivation steps between the held convention and the root. */
    public int depth() {
        return path.size() - 1;
    }

    /**
     * Re-expresses a triple of the held convention in the root convention,
     * applying each toParent on the way up.
     */
    public AngleTriple toRoot(AngleTriple angles) {
        Objects.requireNonNull(angles, "angles must not be null");
        AngleTriple current = angles;
        for (int n = 0; n < path.size() - 1; n++) {
            current = derivation(n).toParent().apply(current);
        }
        return current;
    }

    /**
     * Re-expresses a root triple in the held convention,
     * applying each fromParent on the way down.
     */
    public AngleTriple fromRoot(AngleTriple rootAngles) {
        Objects.requireNonNull(rootAngles, "rootAngles must not be null");
        AngleTriple current = rootAngles;
        for (int n = path.size() - 2; n >= 0; n--) {
            current = derivation(n).fromParent().apply(current);
        }
        return current;
    }

    private DerivedDefinition derivation(int index) {
        return (DerivedDefinition) path.get(index).definition();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ConventionDescriptor c : path) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(c.name());
        }
        return sb.toString();
    }
}
