package com.github.seamorder.image;

/**
 * An RGB pixel. Each channel is in [0, 255].
 *
 * @param red   red channel
 * @param green green channel
 * @param blue  blue channel
 */
public record Pixel(int red, int green, int blue) {
    /**
     * Number of color channels.
     */
    public static final int CHANNELS = 3;

    /**
     * @throws IllegalArgumentException if a channel is out of range
     */
    public Pixel {
        if (outOfRange(red) || outOfRange(green) || outOfRange(blue)) {
            throw new IllegalArgumentException("channels must be in [0, 255]: " + red + " " + green + " " + blue);
        }
    }

    /**
     * @param value a channel value
     * @return true if it does not fit in a channel
     */
    static boolean outOfRange(int value) {
        return value < 0 || value > 255;
    }

    /**
     * Sum of absolute channel differences.
     *
     * @param other another pixel
     * @return the distance, in [0, 765]
     */
    public int distance(Pixel other) {
        return Math.abs(red - other.red) + Math.abs(green - other.green) + Math.abs(blue - other.blue);
    }
}
