package org.euler.convention;

/**
 * Thrown when a name or alias does not match any registered convention.
 */
public class UnknownConventionException extends IllegalArgumentException {

    private final String requestedName;

    public UnknownConventionException(String requestedName) {
        super("Unknown Euler angles convention: '" + requestedName + "'");
        this.requestedName = requestedName;
    }

    public String requestedName() {
        return requestedName;
    }
}
