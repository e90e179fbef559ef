package org.sunrise.callisto.filter;

import org.sunrise.callisto.Spectrogram;

/**
 * Estimates the local intensity gradient with a 3x3 Sobel operator and turns it
 * into an orientation field.
 *
 * <p>
 * {@code Gx} correlates the time axis with {@code [-1, 0, 1]} and smooths the
 * frequency axis with {@code [1, 2, 1]}; {@code Gy} is the converse. Pixels
 * beyond the border are taken from the mirrored interior, never from zero
 * padding, so the array edges do not look like steps.
 */
public class GradientEstimator {

    /**
     * Orientation assigned where both derivatives are zero. It corresponds to
     * {@code atan2(0, 0) = 0}, i.e. sampling along the frequency axis.
     */
    public static final double FLAT_ORIENTATION = Math.PI / 2;

    private final BoundaryMode boundaryMode;

    public GradientEstimator() {
        this(BoundaryMode.REFLECT);
    }

    public GradientEstimator(BoundaryMode boundaryMode) {
        this.boundaryMode = boundaryMode;
    }

    public GradientField computeGradient(Spectrogram spectrogram) {
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        int[] left = new int[nCols];
        int[] right = new int[nCols];
        for (int c = 0; c < nCols; c++) {
            left[c] = boundaryMode.map(c - 1, nCols);
            right[c] = boundaryMode.map(c + 1, nCols);
        }
        double[][] gx = new double[nRows][nCols];
        double[][] gy = new double[nRows][nCols];
        for (int r = 0; r < nRows; r++) {
            int up = boundaryMode.map(r - 1, nRows);
            int down = boundaryMode.map(r + 1, nRows);
            for (int c = 0; c < nCols; c++) {
                int cl = left[c];
                int cr = right[c];
                gx[r][c] = (spectrogram.get(up, cr) - spectrogram.get(up, cl))
                        + 2 * (spectrogram.get(r, cr) - spectrogram.get(r, cl))
                        + (spectrogram.get(down, cr) - spectrogram.get(down, cl));
                gy[r][c] = (spectrogram.get(down, cl) - spectrogram.get(up, cl))
                        + 2 * (spectrogram.get(down, c) - spectrogram.get(up, c))
                        + (spectrogram.get(down, cr) - spectrogram.get(up, cr));
            }
        }
        return new GradientField(gx, gy);
    }

    /**
     * Compute {@code atan2(Gy, Gx) + π/2} for every pixel. A zero gradient
     * (of either sign) yields {@link #FLAT_ORIENTATION}.
     */
    public OrientationField computeOrientation(GradientField gradient) {
        int nRows = gradient.getRows();
        int nCols = gradient.getColumns();
        double[][] theta = new double[nRows][nCols];
        for (int r = 0; r < nRows; r++) {
            for (int c = 0; c < nCols; c++) {
                theta[r][c] = orientation(gradient.getGx(r, c), gradient.getGy(r, c));
            }
        }
        return new OrientationField(theta);
    }

    public OrientationField computeOrientation(Spectrogram spectrogram) {
        return computeOrientation(computeGradient(spectrogram));
    }

    static double orientation(double gx, double gy) {
        if (gx == 0 && gy == 0) {
            return FLAT_ORIENTATION;
        }
        return Math.atan2(gy, gx) + Math.PI / 2;
    }
}
