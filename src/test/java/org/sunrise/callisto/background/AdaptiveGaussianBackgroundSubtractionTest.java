package org.sunrise.callisto.background;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import org.junit.Test;
import org.sunrise.callisto.InvalidParameterException;
import org.sunrise.callisto.Spectrogram;

public class AdaptiveGaussianBackgroundSubtractionTest {

    @Test
    public void testDefaultWindow() {
        assertEquals(240, new AdaptiveGaussianBackgroundSubtraction().getWindow());
        assertEquals(12, new AdaptiveGaussianBackgroundSubtraction(3, 4).getWindow());
    }

    @Test
    public void testRollingMeanOddWindow() {
        double[] band = {1, 2, 3, 4, 5};
        assertArrayEquals(new double[]{1, 2, 3, 4, 3}, AdaptiveGaussianBackgroundSubtraction.rollingMean(band, 3), 1e-12);
    }

    @Test
    public void testRollingMeanEvenWindow() {
        // Two samples before, one after
        double[] band = {1, 2, 3, 4, 5};
        assertArrayEquals(new double[]{0.75, 1.5, 2.5, 3.5, 3}, AdaptiveGaussianBackgroundSubtraction.rollingMean(band, 4), 1e-12);
    }

    @Test
    public void testRollingMeanWindowLongerThanBand() {
        double[] band = {4, 4};
        assertArrayEquals(new double[]{0.8, 0.8}, AdaptiveGaussianBackgroundSubtraction.rollingMean(band, 10), 1e-12);
    }

    @Test
    public void testConstantBandRemoved() {
        double[][] data = new double[2][8];
        for (int c = 0; c < 8; c++) {
            data[0][c] = 5;
            data[1][c] = -2;
        }
        Spectrogram result = new AdaptiveGaussianBackgroundSubtraction(3, 1).subtract(Spectrogram.of(data));
        for (int c = 1; c < 7; c++) {
            assertEquals(0, result.get(0, c), 1e-12);
            assertEquals(0, result.get(1, c), 1e-12);
        }
        // The zero padding lowers the background at the ends
        assertEquals(5 - 10.0 / 3, result.get(0, 0), 1e-12);
        assertEquals(5 - 10.0 / 3, result.get(0, 7), 1e-12);
    }

    @Test
    public void testBurstKeepsSignal() {
        double[][] data = new double[1][20];
        data[0][10] = 100;
        Spectrogram result = new AdaptiveGaussianBackgroundSubtraction(3, 1).subtract(Spectrogram.of(data));
        // Above mean + 3 sigma, so only the band mean of 5 is removed
        assertEquals(95, result.get(0, 10), 1e-12);
        assertEquals(-100.0 / 3, result.get(0, 9), 1e-12);
        assertEquals(-100.0 / 3, result.get(0, 11), 1e-12);
        assertEquals(0, result.get(0, 0), 1e-12);
    }

    @Test
    public void testShapePreserved() {
        Spectrogram input = Spectrogram.of(new double[3][7]);
        Spectrogram result = new AdaptiveGaussianBackgroundSubtraction().subtract(input);
        assertEquals(3, result.getRows());
        assertEquals(7, result.getColumns());
    }

    @Test(expected = InvalidParameterException.class)
    public void testZeroWindow() {
        new AdaptiveGaussianBackgroundSubtraction(0, 4);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNegativeRate() {
        new AdaptiveGaussianBackgroundSubtraction(60, -1);
    }

    @Test
    public void testEquality() {
        assertEquals(new AdaptiveGaussianBackgroundSubtraction(60, 4), new AdaptiveGaussianBackgroundSubtraction(30, 8));
        assertNotEquals(new AdaptiveGaussianBackgroundSubtraction(60, 4), new AdaptiveGaussianBackgroundSubtraction(60, 1));
        assertNotEquals(new AdaptiveGaussianBackgroundSubtraction(), new NullBackgroundSubtraction());
    }

    @Test
    public void testNullBackground() {
        Spectrogram input = Spectrogram.of(new double[][]{{1, 2}, {3, 4}});
        NullBackgroundSubtraction none = new NullBackgroundSubtraction();
        assertSame(input, none.subtract(input));
        assertEquals(0, none.compute(input).level(1, 1), 0);
        assertEquals(new NullBackgroundSubtraction(), none);
    }
}
