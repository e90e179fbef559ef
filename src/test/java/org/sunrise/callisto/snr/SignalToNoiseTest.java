package org.sunrise.callisto.snr;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.sunrise.callisto.Spectrogram;

public class SignalToNoiseTest {

    private static Spectrogram burstAt2And3() {
        return Spectrogram.of(new double[][]{
            {1, 1, 12, 12, 1, 1},
            {1, 1, 8, 8, 1, 1}
        });
    }

    @Test
    public void testFlux() {
        assertArrayEquals(new double[]{1, 1, 10, 10, 1, 1}, SignalToNoise.flux(burstAt2And3()), 0);
    }

    @Test
    public void testSnr() {
        SignalToNoise snr = SignalToNoise.compute(burstAt2And3(), Collections.singletonList(new BurstLabel("typeIII", 2, 3)));
        assertEquals(10, snr.getSignalMean(), 0);
        assertEquals(1, snr.getNoiseMean(), 0);
        assertEquals(10, snr.getSnrDb(), 1e-12);
    }

    @Test
    public void testLabelsClippedToSpectrogram() {
        SignalToNoise snr = SignalToNoise.compute(burstAt2And3(), Arrays.asList(
                new BurstLabel("early", -5, 1),
                new BurstLabel("late", 4, 100)));
        assertEquals(1, snr.getSignalMean(), 0);
        assertEquals(10, snr.getNoiseMean(), 0);
        assertEquals(-10, snr.getSnrDb(), 1e-12);
    }

    @Test
    public void testOverlappingLabelsCountedOnce() {
        SignalToNoise snr = SignalToNoise.compute(burstAt2And3(), Arrays.asList(
                new BurstLabel("a", 1, 2),
                new BurstLabel("b", 2, 2)));
        assertEquals(5.5, snr.getSignalMean(), 1e-12);
        assertEquals(3.25, snr.getNoiseMean(), 1e-12);
    }

    @Test
    public void testEmptyRangeIgnored() {
        SignalToNoise snr = SignalToNoise.compute(burstAt2And3(), Collections.singletonList(new BurstLabel("backwards", 5, 2)));
        assertTrue(Double.isNaN(snr.getSignalMean()));
        assertEquals(4, snr.getNoiseMean(), 1e-12);
        assertTrue(Double.isNaN(snr.getSnrDb()));
    }

    @Test
    public void testZeroNoise() {
        Spectrogram s = Spectrogram.of(new double[][]{{0, 5, 0}});
        SignalToNoise snr = SignalToNoise.compute(s, Collections.singletonList(new BurstLabel("x", 1, 1)));
        assertEquals(0, snr.getNoiseMean(), 0);
        assertTrue(Double.isNaN(snr.getSnrDb()));
    }
}
