package org.sunrise.callisto.background;

import org.sunrise.callisto.Spectrogram;

/**
 * Estimates the background level of a spectrogram so that it can be removed.
 */
public interface BackgroundSubtraction {

    BackgroundLevels compute(Spectrogram spectrogram);

    /**
     * Subtract the computed background from every pixel.
     */
    default Spectrogram subtract(Spectrogram spectrogram) {
        BackgroundLevels levels = compute(spectrogram);
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        double[][] result = new double[nRows][nCols];
        for (int row = 0; row < nRows; row++) {
            for (int col = 0; col < nCols; col++) {
                result[row][col] = spectrogram.get(row, col) - levels.level(row, col);
            }
        }
        return Spectrogram.wrap(result);
    }

    public interface BackgroundLevels {

        public double level(int row, int col);

    }
}
