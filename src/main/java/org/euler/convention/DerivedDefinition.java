package org.euler.convention;

import java.util.Objects;

/**
 * A convention whose angles are a reparameterization of its parent's angles.
 * The parent is referenced by name and looked up in a {@link ConventionRegistry}.
 *
 * @param parentName name or alias of the parent convention
 * @param toParent   maps a triple of this convention to the parent's triple
 * @param fromParent maps a parent triple back; the exact inverse of toParent
 */
public record DerivedDefinition(String parentName, AngleTransform toParent, AngleTransform fromParent)
        implements ConventionDefinition {

    public DerivedDefinition {
        if (parentName == null || parentName.isBlank()) {
            throw new IllegalArgumentException("parentName must be non-empty");
        }
        Objects.requireNonNull(toParent, "toParent must not be null");
        Objects.requireNonNull(fromParent, "fromParent must not be null");
    }

    /**
     * Derivation through an affine map whose inverse is computed.
     */
    public static DerivedDefinition affine(String parentName, AffineAngleTransform toParent) {
        Objects.requireNonNull(toParent, "toParent must not be null");
        return new DerivedDefinition(parentName, toParent, toParent.inverse());
    }

    @Override
    public boolean isBase() {
        return false;
    }
}
