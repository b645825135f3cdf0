package com.autoprof.orchestrator.image;

import java.util.Objects;

/**
 * A two-dimensional frame of pixel values, indexed {@code [row][column]}.
 *
 * The engine only inspects the frame to reject images whose centre is
 * missing; everything else is up to the steps.
 */
public final class ImageData {

    private final double[][] pixels;

    public ImageData(double[][] pixels) {
        this.pixels = Objects.requireNonNull(pixels, "pixels");
    }

    public int height() {
        return pixels.length;
    }

    public int width() {
        return pixels.length == 0 ? 0 : pixels[0].length;
    }

    public double get(int row, int column) {
        return pixels[row][column];
    }

    /** The backing array; steps that transform the image should build a new one. */
    public double[][] pixels() {
        return pixels;
    }

    /**
     * True when every pixel in the {@code size x size} window centred on the
     * frame midpoint is exactly zero. The window is clamped to the frame, so an
     * empty frame (or a window with no pixels) counts as blank.
     */
    public boolean isCentreBlank(int size) {
        int half = size / 2;
        int midRow = height() / 2;
        int midCol = width() / 2;
        int rowFrom = Math.max(0, midRow - half);
        int rowTo   = Math.min(height(), midRow + half);
        int colFrom = Math.max(0, midCol - half);
        int colTo   = Math.min(width(), midCol + half);

        for (int r = rowFrom; r < rowTo; r++) {
            double[] row = pixels[r];
            for (int c = colFrom; c < Math.min(colTo, row.length); c++) {
                if (row[c] != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }
}
