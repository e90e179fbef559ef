package org.sunrise.callisto.background;

import org.sunrise.callisto.Spectrogram;

/**
 * Leaves the spectrogram unchanged.
 */
public class NullBackgroundSubtraction implements BackgroundSubtraction {

    private static final BackgroundLevels NO_BACKGROUND = (int row, int col) -> 0;

    @Override
    public BackgroundLevels compute(Spectrogram spectrogram) {
        return NO_BACKGROUND;
    }

    @Override
    public Spectrogram subtract(Spectrogram spectrogram) {
        return spectrogram;
    }

    @Override
    public boolean equals(Object obj) {
        return obj != null && this.getClass().equals(obj.getClass());
    }

    @Override
    public int hashCode() {
        return NullBackgroundSubtraction.class.hashCode();
    }

}
