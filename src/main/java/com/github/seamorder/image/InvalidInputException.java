package com.github.seamorder.image;

/**
 * Thrown when a set of images cannot be ordered: none at all, an empty image, or images of different sizes.
 */
public class InvalidInputException extends IllegalArgumentException {
    /**
     * @param message detail message
     */
    public InvalidInputException(String message) {
        super(message);
    }
}
