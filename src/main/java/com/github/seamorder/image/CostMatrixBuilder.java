package com.github.seamorder.image;

import com.github.seamorder.atsp.CostMatrix;
import org.ojalgo.netio.BasicLogger;

import java.util.List;

/**
 * Derives directed seam costs between images. The cost of placing image <code>j</code> directly after image
 * <code>i</code> is the sum, over all rows and channels, of the absolute difference between the last pixel of
 * <code>i</code>'s row and the first pixel of <code>j</code>'s row. Node 0 of the result is a zero-cost depot;
 * image <code>k</code> of the input is node <code>k + 1</code>.
 */
public class CostMatrixBuilder {
    private boolean debug;

    /**
     * Default constructor
     */
    public CostMatrixBuilder() {
    }

    /**
     * @param images the images, in input order
     * @return an (n+1)x(n+1) cost matrix
     * @throws InvalidInputException if there are no images, an image is empty, or sizes differ
     */
    public CostMatrix build(List<Image> images) {
        validate(images);

        var size = images.size() + 1;
        var costs = new long[size][size];

        for (var i = 1; i < size; i++) {
            for (var j = 1; j < size; j++) {
                if (i != j) {
                    costs[i][j] = seamCost(images.get(i - 1), images.get(j - 1));
                }
            }
        }

        if (debug) {
            for (var i = 1; i < size - 1; i++) {
                for (var j = i + 1; j < size; j++) {
                    BasicLogger.debug("Cost between image " + i + " and " + j + " is " + costs[i][j] +
                            ", reverse is " + costs[j][i]);
                }
            }
        }
        return CostMatrix.of(costs);
    }

    /**
     * @param left  the image placed first
     * @param right the image placed directly after <code>left</code>
     * @return the seam cost between the right edge of <code>left</code> and the left edge of <code>right</code>
     */
    public static long seamCost(Image left, Image right) {
        var total = 0L;

        for (var row = 0; row < left.getHeight(); row++) {
            total += left.rightEdge(row).distance(right.leftEdge(row));
        }
        return total;
    }

    private static void validate(List<Image> images) {
        if (images.isEmpty()) {
            throw new InvalidInputException("at least one image is required");
        }

        var first = images.get(0);

        for (var k = 0; k < images.size(); k++) {
            var image = images.get(k);

            if (image.isEmpty()) {
                throw new InvalidInputException("image " + (k + 1) + " is empty");
            }
            if (image.getHeight() != first.getHeight() || image.getWidth() != first.getWidth()) {
                throw new InvalidInputException("image " + (k + 1) + " is " + image.getWidth() + "x" +
                        image.getHeight() + ", expected " + first.getWidth() + "x" + first.getHeight());
            }
        }
    }

    /**
     * Get the debug property
     *
     * @return true if per-pair costs are logged
     */
    @SuppressWarnings("unused")
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, the costs of every pair are logged via ojAlgo's {@link BasicLogger}.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
