package com.hogfeatures.extractor;

/**
 * Thrown when an extraction parameter or input image violates a constraint.
 * Raised before any computation starts, so no partial result is ever produced.
 */
public class InvalidArgumentException extends IllegalArgumentException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidArgumentException(name + " must be positive, got " + value);
        }
    }
}
