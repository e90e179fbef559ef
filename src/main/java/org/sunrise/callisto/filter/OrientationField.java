package org.sunrise.callisto.filter;

/**
 * Per-pixel angle (radians) of the direction of least intensity change. Read
 * only once built.
 */
public class OrientationField {

    private final double[][] theta;

    OrientationField(double[][] theta) {
        this.theta = theta;
    }

    public double get(int row, int col) {
        return theta[row][col];
    }

    public int getRows() {
        return theta.length;
    }

    public int getColumns() {
        return theta[0].length;
    }
}
