package org.euler.model;

/**
 * Thrown when an angle triple is built from a number of values other than 3.
 */
public class InvalidTripleLengthException extends IllegalArgumentException {

    private final int length;

    public InvalidTripleLengthException(int length) {
        super("An angle triple needs exactly 3 values but got " + length);
        this.length = length;
    }

    public int length() {
        return length;
    }
}
