package org.euler.io;

import org.euler.convention.ConventionDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * A parsed convention table: the descriptors in table order and the name of the default convention.
 * Consistency across entries (unique aliases, parents) is checked when a registry is built from it.
 */
public record ConventionTable(String defaultName, List<ConventionDescriptor> conventions) {

    public ConventionTable {
        if (defaultName == null || defaultName.isBlank()) {
            throw new IllegalArgumentException("defaultName must be non-empty");
        }
        Objects.requireNonNull(conventions, "conventions must not be null");
        conventions = List.copyOf(conventions);
    }
}
