package org.euler.angles;

import org.euler.convention.ConventionChain;
import org.euler.convention.ConventionDescriptor;
import org.euler.convention.ConventionRegistry;
import org.euler.decompose.EulerComposer;
import org.euler.decompose.EulerDecomposer;
import org.euler.model.AngleTriple;
import org.euler.model.Matrix3;
import org.euler.model.Quaternion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * An Euler angle triple together with the convention that gives it meaning.
 *
 * Every conversion goes through the rotation matrix of the root (base) convention:
 * derived conventions are mapped up their parent chain with toParent before composing,
 * and down with fromParent after decomposing.
 *
 * Instances are mutable and not synchronized. A failed call leaves angles and convention unchanged.
 */
public final class EulerAngles {

    private static final Logger log = LoggerFactory.getLogger(EulerAngles.class);

    private final ConventionRegistry registry;
    private AngleTriple angles;
    private ConventionDescriptor convention;

    /**
     * Angles in the given convention, resolved against {@link ConventionRegistry#standard()}.
     *
     * @throws org.euler.model.InvalidTripleLengthException if angles does not hold exactly 3 values
     */
    public EulerAngles(double[] angles, ConventionDescriptor convention) {
        this(angles, convention, ConventionRegistry.standard());
    }

    public EulerAngles(double[] angles, ConventionDescriptor convention, ConventionRegistry registry) {
        this(AngleTriple.of(angles), convention, registry);
    }

    public EulerAngles(AngleTriple angles, ConventionDescriptor convention, ConventionRegistry registry) {
        this.angles = Objects.requireNonNull(angles, "angles must not be null");
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Decomposes a rotation matrix into the target convention (standard registry).
     */
    public static EulerAngles of(Matrix3 rotation, ConventionDescriptor convention) {
        EulerAngles result = new EulerAngles(AngleTriple.ZERO, convention, ConventionRegistry.standard());
        result.fromRotationMatrix(rotation, convention);
        return result;
    }

    /**
     * Decomposes a quaternion into the target convention (standard registry).
     */
    public static EulerAngles of(Quaternion rotation, ConventionDescriptor convention) {
        EulerAngles result = new EulerAngles(AngleTriple.ZERO, convention, ConventionRegistry.standard());
        result.fromQuaternion(rotation, convention);
        return result;
    }

    /**
     * @return a copy of the angles in radians
     */
    public double[] eulerAngles() {
        return angles.toArray();
    }

    public AngleTriple angles() {
        return angles;
    }

    /**
     * Replaces the angles without touching the convention. Values are taken as-is.
     *
     * @throws org.euler.model.InvalidTripleLengthException if not exactly 3 values are given
     */
    public void setEulerAngles(double... angles) {
        this.angles = AngleTriple.of(angles);
    }

    public void setAngles(AngleTriple angles) {
        this.angles = Objects.requireNonNull(angles, "angles must not be null");
    }

    public ConventionDescriptor convention() {
        return convention;
    }

    public ConventionRegistry registry() {
        return registry;
    }

    /**
     * Rotation matrix of the held angles.
     *
     * @throws org.euler.convention.UnresolvedConventionException if the convention's parent chain is broken
     */
    public Matrix3 rotationMatrix() {
        ConventionChain chain = registry.chainOf(convention);
        return EulerComposer.compose(chain.toRoot(angles), chain.rootCode());
    }

    /**
     * Replaces angles and convention by the decomposition of a rotation matrix.
     *
     * @throws org.euler.model.NonOrthonormalMatrixException if the matrix is not a rotation
     */
    public void fromRotationMatrix(Matrix3 rotation, ConventionDescriptor target) {
        Objects.requireNonNull(rotation, "rotation must not be null");
        Objects.requireNonNull(target, "target must not be null");
        rotation.requireRotation();
        assign(decomposeInto(rotation, target), target);
    }

    public Quaternion toQuaternion() {
        return Quaternion.fromRotationMatrix(rotationMatrix());
    }

    /**
     * Replaces angles and convention by the decomposition of a quaternion.
     * Non-unit quaternions are normalized first.
     */
    public void fromQuaternion(Quaternion rotation, ConventionDescriptor target) {
        Objects.requireNonNull(rotation, "rotation must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Matrix3 m = rotation.normalized().toRotationMatrix();
        assign(decomposeInto(m, target), target);
    }

    /**
     * Re-expresses the same rotation in another convention, always through the rotation matrix.
     */
    public void changeConvention(ConventionDescriptor target) {
        Objects.requireNonNull(target, "target must not be null");
        ConventionDescriptor source = convention;
        assign(decomposeInto(rotationMatrix(), target), target);
        log.debug("Changed convention {} -> {}", source.name(), target.name());
    }

    /**
     * @throws org.euler.convention.UnknownConventionException if the name is not registered
     */
    public void changeConvention(String targetName) {
        changeConvention(registry.resolve(targetName));
    }

    private AngleTriple decomposeInto(Matrix3 rotation, ConventionDescriptor target) {
        ConventionChain chain = registry.chainOf(target);
        AngleTriple rootAngles = EulerDecomposer.decompose(rotation, chain.rootCode());
        return chain.fromRoot(rootAngles);
    }

    private void assign(AngleTriple newAngles, ConventionDescriptor newConvention) {
        this.angles = newAngles;
        this.convention = newConvention;
    }

    @Override
    public String toString() {
        List<String> labels = convention.angleLabels();
        return convention.name() + "("
                + labels.get(0) + "=" + angles.first() + ", "
                + labels.get(1) + "=" + angles.second() + ", "
                + labels.get(2) + "=" + angles.third() + ")";
    }
}
