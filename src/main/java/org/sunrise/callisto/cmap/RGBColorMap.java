package org.sunrise.callisto.cmap;

/**
 * A table of {@code size} packed {@code 0xRRGGBB} colours indexed from low to
 * high intensity.
 */
public abstract class RGBColorMap {

    private final int size;

    public RGBColorMap(int size) {
        this.size = size;
    }

    public abstract int getRGB(int index);

    public int getSize() {
        return size;
    }

    /**
     * Colour for a value scaled to {@code [0, 1]}. Values outside the range use
     * the end colours, NaN uses the lowest.
     */
    public int getRGB(double fraction) {
        if (!(fraction > 0)) {
            return getRGB(0);
        }
        if (fraction >= 1) {
            return getRGB(size - 1);
        }
        return getRGB((int) Math.round(fraction * (size - 1)));
    }
}
