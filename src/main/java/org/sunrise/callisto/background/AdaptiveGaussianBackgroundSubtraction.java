package org.sunrise.callisto.background;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sunrise.callisto.InvalidParameterException;
import org.sunrise.callisto.Spectrogram;

/**
 * Adaptive Gaussian background subtraction, applied to each frequency band
 * independently.
 *
 * <p>
 * The mean and standard deviation of the band are computed over the whole
 * recording. Values more than three standard deviations above the mean are
 * taken to be burst signal and only the long term mean is removed from them.
 * Everything else has a centred rolling mean removed, so slow drifts in the
 * receiver background disappear. The rolling mean treats samples beyond either
 * end of the band as zero.
 */
public class AdaptiveGaussianBackgroundSubtraction implements BackgroundSubtraction {

    private static final Logger LOG = Logger.getLogger(AdaptiveGaussianBackgroundSubtraction.class.getName());

    public static final int DEFAULT_SECONDS_WINDOW = 60;
    /**
     * e-Callisto instruments record four spectra per second.
     */
    public static final int DEFAULT_SAMPLES_PER_SECOND = 4;
    private static final double THRESHOLD_SIGMAS = 3.0;

    private final int window;

    public AdaptiveGaussianBackgroundSubtraction() {
        this(Integer.getInteger("org.sunrise.callisto.background.secondsWindow", DEFAULT_SECONDS_WINDOW), DEFAULT_SAMPLES_PER_SECOND);
    }

    /**
     * @param secondsWindow Length of the rolling mean in seconds
     * @param samplesPerSecond Time samples per second of recording
     */
    public AdaptiveGaussianBackgroundSubtraction(int secondsWindow, int samplesPerSecond) {
        if (secondsWindow <= 0 || samplesPerSecond <= 0) {
            throw new InvalidParameterException("Rolling window must be positive: " + secondsWindow + "s at " + samplesPerSecond + "/s");
        }
        this.window = secondsWindow * samplesPerSecond;
    }

    public int getWindow() {
        return window;
    }

    @Override
    public BackgroundLevels compute(Spectrogram spectrogram) {
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        double[][] levels = new double[nRows][];
        int bursts = 0;
        for (int row = 0; row < nRows; row++) {
            double[] band = new double[nCols];
            for (int col = 0; col < nCols; col++) {
                band[col] = spectrogram.get(row, col);
            }
            double mean = Arrays.stream(band).average().getAsDouble();
            double sumSq = 0;
            for (double v : band) {
                sumSq += (v - mean) * (v - mean);
            }
            double sigma = Math.sqrt(sumSq / nCols);
            double threshold = mean + THRESHOLD_SIGMAS * sigma;

            double[] level = rollingMean(band, window);
            for (int col = 0; col < nCols; col++) {
                if (band[col] > threshold) {
                    level[col] = mean;
                    bursts++;
                }
            }
            levels[row] = level;
        }
        LOG.log(Level.FINE, "{0} of {1} pixels above the burst threshold", new Object[]{bursts, (long) nRows * nCols});
        return new RowLevels(levels);
    }

    /**
     * Centred moving average of width {@code window}, zero beyond the ends.
     * Column {@code i} averages columns
     * {@code i - ceil((window-1)/2) .. i + floor((window-1)/2)}.
     */
    static double[] rollingMean(double[] band, int window) {
        int n = band.length;
        double[] prefix = new double[n + 1];
        for (int i = 0; i < n; i++) {
            prefix[i + 1] = prefix[i] + band[i];
        }
        int after = (window - 1) / 2;
        int before = window - 1 - after;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - before);
            int to = Math.min(n, i + after + 1);
            result[i] = from < to ? (prefix[to] - prefix[from]) / window : 0;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return window == ((AdaptiveGaussianBackgroundSubtraction) obj).window;
    }

    @Override
    public int hashCode() {
        return 31 * AdaptiveGaussianBackgroundSubtraction.class.hashCode() + window;
    }

    private static class RowLevels implements BackgroundLevels {

        private final double[][] levels;

        private RowLevels(double[][] levels) {
            this.levels = levels;
        }

        @Override
        public double level(int row, int col) {
            return levels[row][col];
        }

        @Override
        public String toString() {
            return "RowLevels{" + "rows=" + levels.length + '}';
        }
    }
}
