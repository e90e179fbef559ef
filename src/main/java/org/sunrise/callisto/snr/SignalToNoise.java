package org.sunrise.callisto.snr;

import java.util.BitSet;
import java.util.List;
import org.sunrise.callisto.Spectrogram;

/**
 * Signal-to-noise ratio of a spectrogram given the time ranges that contain
 * bursts. The spectrogram is first collapsed to a flux time series by averaging
 * over frequency. The signal is the mean flux inside the bursts, the noise the
 * mean flux everywhere else.
 */
public class SignalToNoise {

    private final double signalMean;
    private final double noiseMean;
    private final double snrDb;

    private SignalToNoise(double signalMean, double noiseMean) {
        this.signalMean = signalMean;
        this.noiseMean = noiseMean;
        this.snrDb = signalMean != 0 && noiseMean != 0 ? 10 * Math.log10(signalMean / noiseMean) : Double.NaN;
    }

    /**
     * @param spectrogram The (usually filtered) spectrogram
     * @param labels Burst ranges over the time axis; ranges are clipped to the
     * spectrogram and may overlap
     * @return The result. Means are NaN when no column falls in (or outside)
     * the bursts, and the ratio is NaN when either mean is zero or NaN.
     */
    public static SignalToNoise compute(Spectrogram spectrogram, List<BurstLabel> labels) {
        double[] flux = flux(spectrogram);
        int nTimes = flux.length;
        BitSet burst = new BitSet(nTimes);
        for (BurstLabel label : labels) {
            int start = Math.max(0, label.getStartIndex());
            int end = Math.min(nTimes - 1, label.getEndIndex());
            if (start <= end) {
                burst.set(start, end + 1);
            }
        }
        double inside = 0;
        double outside = 0;
        int nInside = 0;
        for (int t = 0; t < nTimes; t++) {
            if (burst.get(t)) {
                inside += flux[t];
                nInside++;
            } else {
                outside += flux[t];
            }
        }
        int nOutside = nTimes - nInside;
        return new SignalToNoise(nInside > 0 ? inside / nInside : Double.NaN, nOutside > 0 ? outside / nOutside : Double.NaN);
    }

    /**
     * @return The mean over frequency of each time column
     */
    public static double[] flux(Spectrogram spectrogram) {
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        double[] flux = new double[nCols];
        for (int col = 0; col < nCols; col++) {
            double sum = 0;
            for (int row = 0; row < nRows; row++) {
                sum += spectrogram.get(row, col);
            }
            flux[col] = sum / nRows;
        }
        return flux;
    }

    public double getSignalMean() {
        return signalMean;
    }

    public double getNoiseMean() {
        return noiseMean;
    }

    public double getSnrDb() {
        return snrDb;
    }

    @Override
    public String toString() {
        return String.format("SignalToNoise{signalMean=%.3f, noiseMean=%.3f, snr=%.2f dB}", signalMean, noiseMean, snrDb);
    }
}
