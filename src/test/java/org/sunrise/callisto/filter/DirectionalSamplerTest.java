package org.sunrise.callisto.filter;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Test;
import org.sunrise.callisto.Spectrogram;

public class DirectionalSamplerTest {

    private static final double TOLERANCE = 1e-9;

    /**
     * value = 10 * row + col, which bilinear interpolation reproduces exactly
     */
    private static Spectrogram plane(int rows, int cols) {
        double[][] data = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                data[r][c] = 10 * r + c;
            }
        }
        return Spectrogram.of(data);
    }

    @Test
    public void testZeroOffsetIsPixel() {
        Spectrogram s = plane(4, 5);
        DirectionalSampler sampler = new DirectionalSampler();
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 5; c++) {
                assertEquals(s.get(r, c), sampler.sample(s, r, c, 1.234, 0), 0);
            }
        }
    }

    @Test
    public void testDiagonalInterpolation() {
        Spectrogram s = plane(10, 10);
        DirectionalSampler sampler = new DirectionalSampler();
        double theta = Math.PI / 4;
        double step = Math.sqrt(0.5);
        for (int k = -3; k <= 3; k++) {
            double expected = 10 * (5 + k * step) + (4 + k * step);
            assertEquals("k=" + k, expected, sampler.sample(s, 5, 4, theta, k), TOLERANCE);
        }
    }

    @Test
    public void testFractionalCoordinate() {
        double[][] data = {{0, 4}, {8, 12}};
        DirectionalSampler sampler = new DirectionalSampler();
        assertEquals(6, sampler.interpolate(Spectrogram.of(data), 0.5, 0.5), TOLERANCE);
        assertEquals(1, sampler.interpolate(Spectrogram.of(data), 0, 0.25), TOLERANCE);
        assertEquals(10, sampler.interpolate(Spectrogram.of(data), 1, 0.5), TOLERANCE);
    }

    @Test
    public void testReflectionAtLeftAndRightEdges() {
        // One row ramp 0,1,2,3 sampled horizontally
        Spectrogram ramp = plane(1, 4);
        DirectionalSampler sampler = new DirectionalSampler(BoundaryMode.REFLECT);
        assertEquals(0, sampler.sample(ramp, 0, 0, 0, -1), TOLERANCE);
        assertEquals(1, sampler.sample(ramp, 0, 0, 0, -2), TOLERANCE);
        assertEquals(2, sampler.sample(ramp, 0, 0, 0, -3), TOLERANCE);
        assertEquals(3, sampler.sample(ramp, 0, 3, 0, 1), TOLERANCE);
        assertEquals(2, sampler.sample(ramp, 0, 3, 0, 2), TOLERANCE);
        // Half way past the edge sits on the repeated edge pixel
        assertEquals(0, sampler.interpolate(ramp, 0, -0.5), TOLERANCE);
        assertEquals(3, sampler.interpolate(ramp, 0, 3.5), TOLERANCE);
    }

    @Test
    public void testReflectionAtTopAndBottomEdges() {
        // Column ramp 0,10,20 sampled vertically
        Spectrogram ramp = plane(3, 1);
        DirectionalSampler sampler = new DirectionalSampler();
        double up = Math.PI / 2;
        assertEquals(0, sampler.sample(ramp, 0, 0, up, -1), TOLERANCE);
        assertEquals(10, sampler.sample(ramp, 0, 0, up, -2), TOLERANCE);
        assertEquals(20, sampler.sample(ramp, 2, 0, up, 1), TOLERANCE);
        assertEquals(10, sampler.sample(ramp, 2, 0, up, 2), TOLERANCE);
    }

    @Test
    public void testMirrorBoundary() {
        Spectrogram ramp = plane(1, 4);
        DirectionalSampler sampler = new DirectionalSampler(BoundaryMode.MIRROR);
        assertEquals(1, sampler.sample(ramp, 0, 0, 0, -1), TOLERANCE);
        assertEquals(2, sampler.sample(ramp, 0, 3, 0, 1), TOLERANCE);
    }

    @Test
    public void testOutOfBoundsNeverZeroOrWrapped() {
        double[][] data = {{5, 6, 7, 8}};
        Spectrogram s = Spectrogram.of(data);
        DirectionalSampler sampler = new DirectionalSampler();
        double left = sampler.sample(s, 0, 0, 0, -1);
        double right = sampler.sample(s, 0, 3, 0, 1);
        assertEquals(5, left, TOLERANCE);
        assertEquals(8, right, TOLERANCE);
    }

    @Test
    public void testSampleLineMatchesSingleSamples() {
        Spectrogram s = plane(6, 7);
        DirectionalSampler sampler = new DirectionalSampler();
        double theta = 0.3;
        double[] line = new double[7];
        sampler.sampleLine(s, 2, 3, Math.sin(theta), Math.cos(theta), 3, line, 0);
        double[] expected = new double[7];
        for (int k = -3; k <= 3; k++) {
            expected[k + 3] = sampler.sample(s, 2, 3, theta, k);
        }
        assertArrayEquals(expected, line, 0);
    }

    @Test
    public void testDeterministic() {
        Spectrogram s = plane(6, 7);
        DirectionalSampler sampler = new DirectionalSampler();
        assertEquals(sampler.sample(s, 1, 6, 2.5, 4), sampler.sample(s, 1, 6, 2.5, 4), 0);
    }
}
