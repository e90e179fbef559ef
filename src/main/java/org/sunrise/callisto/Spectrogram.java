package org.sunrise.callisto;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable frequency x time intensity array. Rows are frequency bins,
 * columns are time samples.
 */
public final class Spectrogram {

    private final double[][] data;
    private final int rows;
    private final int cols;

    private Spectrogram(double[][] data) {
        this.data = data;
        this.rows = data.length;
        this.cols = data[0].length;
    }

    /**
     * Create a spectrogram from a 2D array. The array is copied.
     *
     * @param data The intensities, indexed [row][column]
     * @return The spectrogram
     * @throws InvalidShapeException If the array is empty or ragged
     */
    public static Spectrogram of(double[][] data) {
        checkShape(data);
        double[][] copy = new double[data.length][];
        for (int row = 0; row < data.length; row++) {
            copy[row] = data[row].clone();
        }
        return new Spectrogram(copy);
    }

    /**
     * Create a spectrogram from an arbitrary primitive array, such as the kernel
     * of a FITS image. Only exactly 2-dimensional numeric arrays are accepted.
     *
     * @param array A {@code byte[][]}, {@code short[][]}, {@code int[][]},
     * {@code long[][]}, {@code float[][]} or {@code double[][]}
     * @return The spectrogram
     * @throws InvalidShapeException If the array is not a non-empty rectangular
     * 2D numeric array
     */
    public static Spectrogram of(Object array) {
        return of(array, false, 0.0, 1.0);
    }

    /**
     * Create a spectrogram from an arbitrary primitive array, applying a linear
     * transformation {@code zero + scale * raw} to every element.
     *
     * @param array The 2D primitive array
     * @param unsignedBytes If true {@code byte} elements are read as 0..255
     * @param zero Offset added to each scaled element
     * @param scale Factor applied to each raw element
     * @return The spectrogram
     */
    public static Spectrogram of(Object array, boolean unsignedBytes, double zero, double scale) {
        int dimensions = dimensions(array);
        if (dimensions != 2) {
            throw new InvalidShapeException("Spectrogram must be a 2D array, got " + dimensions + " dimensions");
        }
        int nRows = Array.getLength(array);
        if (nRows == 0) {
            throw new InvalidShapeException("Spectrogram has no rows");
        }
        double[][] result = new double[nRows][];
        for (int row = 0; row < nRows; row++) {
            Object line = Array.get(array, row);
            if (line == null) {
                throw new InvalidShapeException("Spectrogram row " + row + " is missing");
            }
            int n = Array.getLength(line);
            double[] values = new double[n];
            if (line instanceof byte[] b) {
                for (int i = 0; i < n; i++) {
                    values[i] = unsignedBytes ? b[i] & 0xff : b[i];
                }
            } else if (line instanceof short[] s) {
                for (int i = 0; i < n; i++) {
                    values[i] = s[i];
                }
            } else if (line instanceof int[] ia) {
                for (int i = 0; i < n; i++) {
                    values[i] = ia[i];
                }
            } else if (line instanceof long[] l) {
                for (int i = 0; i < n; i++) {
                    values[i] = l[i];
                }
            } else if (line instanceof float[] f) {
                for (int i = 0; i < n; i++) {
                    values[i] = f[i];
                }
            } else if (line instanceof double[] d) {
                System.arraycopy(d, 0, values, 0, n);
            } else {
                throw new InvalidShapeException("Unsupported element type: " + line.getClass().getComponentType());
            }
            if (zero != 0.0 || scale != 1.0) {
                for (int i = 0; i < n; i++) {
                    values[i] = zero + scale * values[i];
                }
            }
            result[row] = values;
        }
        checkShape(result);
        return new Spectrogram(result);
    }

    private static int dimensions(Object array) {
        if (array == null) {
            throw new InvalidShapeException("Spectrogram data is null");
        }
        int dimensions = 0;
        for (Class<?> c = array.getClass(); c.isArray(); c = c.getComponentType()) {
            dimensions++;
        }
        return dimensions;
    }

    private static void checkShape(double[][] data) {
        if (data == null || data.length == 0) {
            throw new InvalidShapeException("Spectrogram has no rows");
        }
        if (data[0] == null || data[0].length == 0) {
            throw new InvalidShapeException("Spectrogram has no columns");
        }
        int width = data[0].length;
        for (int row = 1; row < data.length; row++) {
            if (data[row] == null || data[row].length != width) {
                throw new InvalidShapeException("Spectrogram is not rectangular: row " + row + " differs from row 0");
            }
        }
    }

    /**
     * Concatenate spectrograms along the time axis.
     *
     * @param parts The spectrograms in time order, all with the same number of
     * rows
     * @return The combined spectrogram
     */
    public static Spectrogram concatenate(List<Spectrogram> parts) {
        if (parts.isEmpty()) {
            throw new InvalidShapeException("Nothing to concatenate");
        }
        int nRows = parts.get(0).rows;
        int total = 0;
        for (Spectrogram part : parts) {
            if (part.rows != nRows) {
                throw new InvalidShapeException("Cannot concatenate spectrograms with " + nRows + " and " + part.rows + " frequency bins");
            }
            total += part.cols;
        }
        double[][] result = new double[nRows][total];
        int offset = 0;
        for (Spectrogram part : parts) {
            for (int row = 0; row < nRows; row++) {
                System.arraycopy(part.data[row], 0, result[row], offset, part.cols);
            }
            offset += part.cols;
        }
        return new Spectrogram(result);
    }

    /**
     * @return A copy with the frequency axis reversed
     */
    public Spectrogram flipRows() {
        double[][] result = new double[rows][];
        for (int row = 0; row < rows; row++) {
            result[row] = data[rows - 1 - row].clone();
        }
        return new Spectrogram(result);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return cols;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    /**
     * @return A copy of the intensities as a new array
     */
    public double[][] toArray() {
        double[][] copy = new double[rows][];
        for (int row = 0; row < rows; row++) {
            copy[row] = data[row].clone();
        }
        return copy;
    }

    /**
     * Wrap an array without copying it. The caller hands over ownership and
     * must not modify the array afterwards.
     *
     * @param data A freshly built rectangular array
     * @return The spectrogram backed by {@code data}
     */
    public static Spectrogram wrap(double[][] data) {
        checkShape(data);
        return new Spectrogram(data);
    }

    @Override
    public String toString() {
        return "Spectrogram{" + "rows=" + rows + ", columns=" + cols + '}';
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Spectrogram other = (Spectrogram) obj;
        return Arrays.deepEquals(this.data, other.data);
    }
}
