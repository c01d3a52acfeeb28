package org.euler.io;

/**
 * Where a convention table comes from (classpath resource, file, stream, ...).
 *
 * Implementations should:
 * - load the table once (and optionally cache it)
 * - validate its shape and report the offending entry
 * - return an immutable table
 */
public interface ConventionSource {

    /**
     * Loads (or returns the cached) convention table.
     */
    ConventionTable load();
}
