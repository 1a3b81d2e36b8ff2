package com.github.seamorder.image;

import java.io.IOException;

/**
 * Thrown by {@link ImageReader} on malformed input.
 */
public class ImageParseException extends IOException {
    private final int line;

    /**
     * @param message detail message
     * @param line    1-based line number of the offending input
     */
    public ImageParseException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    /**
     * @return 1-based line number of the offending input
     */
    public int getLine() {
        return line;
    }
}
