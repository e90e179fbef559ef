package org.sunrise.callisto.filter;

/**
 * How an index outside {@code [0, n)} is mapped back into the array. Both modes
 * mirror the data at the border; neither pads with zeros or wraps around.
 */
public enum BoundaryMode {

    /**
     * Half-sample symmetric: the edge pixel is repeated, so -1 maps to 0, -2 to
     * 1 and n to n-1 ({@code d c b a | a b c d | d c b a}).
     */
    REFLECT {
        @Override
        public int map(int index, int n) {
            if (index >= 0 && index < n) {
                return index;
            }
            int period = 2 * n;
            int i = Math.floorMod(index, period);
            return i < n ? i : period - 1 - i;
        }
    },
    /**
     * Whole-sample symmetric: the edge pixel is the mirror axis, so -1 maps to
     * 1 and n to n-2 ({@code d c b | a b c d | c b a}).
     */
    MIRROR {
        @Override
        public int map(int index, int n) {
            if (index >= 0 && index < n) {
                return index;
            }
            if (n == 1) {
                return 0;
            }
            int period = 2 * n - 2;
            int i = Math.floorMod(index, period);
            return i < n ? i : period - i;
        }
    };

    /**
     * Map an index into {@code [0, n)}.
     *
     * @param index Any index, possibly negative or beyond the end
     * @param n The length of the axis, at least 1
     * @return The in-range index whose value stands in for {@code index}
     */
    public abstract int map(int index, int n);
}
