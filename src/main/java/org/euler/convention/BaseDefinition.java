package org.euler.convention;

import java.util.Objects;

/**
 * A convention that decomposes rotations directly with its own axis code.
 */
public record BaseDefinition(AxisCode code) implements ConventionDefinition {

    public BaseDefinition {
        Objects.requireNonNull(code, "code must not be null");
    }

    @Override
    public boolean isBase() {
        return true;
    }
}
