package org.sunrise.callisto.filter;

import org.sunrise.callisto.Spectrogram;

/**
 * Samples a spectrogram along a straight line through a pixel. The sample for
 * offset {@code k} sits at {@code (row + k·sin θ, col + k·cos θ)} and is
 * interpolated bilinearly from the four surrounding pixels, each of which is
 * brought back into range by the {@link BoundaryMode}.
 *
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public class DirectionalSampler {

    private final BoundaryMode boundaryMode;

    public DirectionalSampler() {
        this(BoundaryMode.REFLECT);
    }

    public DirectionalSampler(BoundaryMode boundaryMode) {
        this.boundaryMode = boundaryMode;
    }

    public BoundaryMode getBoundaryMode() {
        return boundaryMode;
    }

    /**
     * Sample at offset {@code k} along angle {@code theta} from pixel
     * {@code (row, col)}.
     */
    public double sample(Spectrogram spectrogram, int row, int col, double theta, int k) {
        return sample(spectrogram, row, col, Math.sin(theta), Math.cos(theta), k);
    }

    /**
     * As {@link #sample(Spectrogram, int, int, double, int)} with the sine and
     * cosine of the angle already computed.
     */
    public double sample(Spectrogram spectrogram, int row, int col, double sin, double cos, int k) {
        return interpolate(spectrogram, row + k * sin, col + k * cos);
    }

    /**
     * Write the {@code 2·radius+1} samples for offsets {@code -radius..radius}
     * into {@code dest}, starting at {@code offset}.
     */
    public void sampleLine(Spectrogram spectrogram, int row, int col, double sin, double cos, int radius, double[] dest, int offset) {
        for (int k = -radius; k <= radius; k++) {
            dest[offset++] = sample(spectrogram, row, col, sin, cos, k);
        }
    }

    /**
     * Bilinear interpolation at a fractional coordinate.
     *
     * @param spectrogram The data
     * @param y Row coordinate, may lie outside the array
     * @param x Column coordinate, may lie outside the array
     * @return The interpolated intensity
     */
    public double interpolate(Spectrogram spectrogram, double y, double x) {
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        double fy = Math.floor(y);
        double fx = Math.floor(x);
        double wy = y - fy;
        double wx = x - fx;
        int r0 = (int) fy;
        int c0 = (int) fx;
        int top = boundaryMode.map(r0, nRows);
        int bottom = boundaryMode.map(r0 + 1, nRows);
        int left = boundaryMode.map(c0, nCols);
        int right = boundaryMode.map(c0 + 1, nCols);

        double v00 = spectrogram.get(top, left);
        double v01 = spectrogram.get(top, right);
        double v10 = spectrogram.get(bottom, left);
        double v11 = spectrogram.get(bottom, right);
        // Written as offsets from the corner so that equal neighbours give back
        // exactly that value.
        double upper = v00 + wx * (v01 - v00);
        double lower = v10 + wx * (v11 - v10);
        return upper + wy * (lower - upper);
    }
}
