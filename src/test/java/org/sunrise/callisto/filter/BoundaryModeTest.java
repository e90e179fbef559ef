package org.sunrise.callisto.filter;

import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class BoundaryModeTest {

    @Test
    public void testReflectRepeatsEdge() {
        BoundaryMode mode = BoundaryMode.REFLECT;
        assertEquals(0, mode.map(-1, 4));
        assertEquals(1, mode.map(-2, 4));
        assertEquals(3, mode.map(-4, 4));
        assertEquals(3, mode.map(4, 4));
        assertEquals(2, mode.map(5, 4));
        assertEquals(0, mode.map(7, 4));
        // A second reflection off the far edge
        assertEquals(0, mode.map(8, 4));
        assertEquals(3, mode.map(-5, 4));
    }

    @Test
    public void testMirrorSkipsEdge() {
        BoundaryMode mode = BoundaryMode.MIRROR;
        assertEquals(1, mode.map(-1, 4));
        assertEquals(2, mode.map(-2, 4));
        assertEquals(2, mode.map(4, 4));
        assertEquals(1, mode.map(5, 4));
        assertEquals(0, mode.map(6, 4));
    }

    @Test
    public void testSingleElementAxis() {
        for (BoundaryMode mode : BoundaryMode.values()) {
            for (int i = -3; i <= 3; i++) {
                assertEquals(mode + " " + i, 0, mode.map(i, 1));
            }
        }
    }

    @Test
    public void testInRangeUnchanged() {
        for (BoundaryMode mode : BoundaryMode.values()) {
            for (int i = 0; i < 5; i++) {
                assertEquals(i, mode.map(i, 5));
            }
        }
    }
}
