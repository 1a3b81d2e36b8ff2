package com.github.seamorder.image;

import java.util.Arrays;

/**
 * An immutable rectangular grid of pixels, indexed by row then column.
 */
public final class Image {
    private final Pixel[][] rows;
    private final int width;

    /**
     * @param rows the pixel rows, all of the same length; copied
     * @throws IllegalArgumentException if the rows differ in length
     */
    public Image(Pixel[][] rows) {
        this.rows = Arrays.stream(rows).map(Pixel[]::clone).toArray(Pixel[][]::new);
        this.width = rows.length == 0 ? 0 : rows[0].length;

        if (Arrays.stream(this.rows).anyMatch(row -> row.length != width)) {
            throw new IllegalArgumentException("all rows must have the same width");
        }
    }

    /**
     * @return number of rows
     */
    public int getHeight() {
        return rows.length;
    }

    /**
     * @return number of columns
     */
    public int getWidth() {
        return width;
    }

    /**
     * @return true if the image has no pixels
     */
    public boolean isEmpty() {
        return rows.length == 0 || width == 0;
    }

    /**
     * @param row row index
     * @param col column index
     * @return the pixel
     */
    public Pixel get(int row, int col) {
        return rows[row][col];
    }

    /**
     * @param row row index
     * @return the first pixel of the row
     */
    public Pixel leftEdge(int row) {
        return rows[row][0];
    }

    /**
     * @param row row index
     * @return the last pixel of the row
     */
    public Pixel rightEdge(int row) {
        return rows[row][width - 1];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Image && Arrays.deepEquals(rows, ((Image) o).rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "Image[" + getHeight() + "x" + width + "]";
    }
}
