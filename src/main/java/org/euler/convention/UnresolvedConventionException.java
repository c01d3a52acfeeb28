package org.euler.convention;

/**
 * Thrown when a derived convention cannot be resolved to a base convention,
 * because a parent is missing or the parent chain loops.
 */
public class UnresolvedConventionException extends IllegalStateException {

    public UnresolvedConventionException(String message) {
        super(message);
    }
}
