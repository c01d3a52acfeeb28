package org.euler.model;

/**
 * Thrown when a matrix handed in as a rotation is not orthonormal with determinant +1.
 */
public class NonOrthonormalMatrixException extends IllegalArgumentException {

    public NonOrthonormalMatrixException(String message) {
        super(message);
    }
}
