package org.sunrise.callisto.filter;

/**
 * Partial derivative estimates of a spectrogram: {@code gx} along time
 * (columns) and {@code gy} along frequency (rows).
 */
public class GradientField {

    private final double[][] gx;
    private final double[][] gy;

    GradientField(double[][] gx, double[][] gy) {
        this.gx = gx;
        this.gy = gy;
    }

    public double getGx(int row, int col) {
        return gx[row][col];
    }

    public double getGy(int row, int col) {
        return gy[row][col];
    }

    public int getRows() {
        return gx.length;
    }

    public int getColumns() {
        return gx[0].length;
    }
}
