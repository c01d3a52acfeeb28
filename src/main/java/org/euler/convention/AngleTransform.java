package org.euler.convention;

import org.euler.model.AngleTriple;

/**
 * Strategy interface for reparameterizing an angle triple between a derived
 * convention and its parent.
 * Implementations must be pure functions; a derived convention pairs two of them
 * that invert each other over the valid angle domain.
 */
@FunctionalInterface
public interface AngleTransform {

    /**
     * @param angles triple in the source convention (non-null)
     * @return the equivalent triple in the target convention
     */
    AngleTriple apply(AngleTriple angles);
}
