package org.euler.convention;

/**
 * How a convention maps its angles to a rotation: either directly through an
 * axis code ({@link BaseDefinition}) or through a parent convention
 * ({@link DerivedDefinition}).
 */
public interface ConventionDefinition {

    boolean isBase();
}
