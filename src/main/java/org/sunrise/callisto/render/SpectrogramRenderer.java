package org.sunrise.callisto.render;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.sunrise.callisto.Spectrogram;
import org.sunrise.callisto.cmap.RGBColorMap;
import org.sunrise.callisto.cmap.SAOColorMap;

/**
 * Draws a spectrogram as an image, one pixel per sample. Time runs left to
 * right and frequency increases upwards, so row 0 of the spectrogram is the
 * bottom line of the image. Intensities are mapped linearly from the data
 * minimum to the data maximum onto the colour map.
 */
public class SpectrogramRenderer {

    public static final RGBColorMap DEFAULT_COLOR_MAP = new SAOColorMap(256, "viridis.sao");

    private final RGBColorMap colorMap;

    public SpectrogramRenderer() {
        this(DEFAULT_COLOR_MAP);
    }

    public SpectrogramRenderer(RGBColorMap colorMap) {
        this.colorMap = colorMap;
    }

    public BufferedImage render(Spectrogram spectrogram) {
        int nRows = spectrogram.getRows();
        int nCols = spectrogram.getColumns();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int row = 0; row < nRows; row++) {
            for (int col = 0; col < nCols; col++) {
                double v = spectrogram.get(row, col);
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        double range = max > min ? max - min : 0;
        BufferedImage image = new BufferedImage(nCols, nRows, BufferedImage.TYPE_INT_RGB);
        for (int row = 0; row < nRows; row++) {
            int y = nRows - 1 - row;
            for (int col = 0; col < nCols; col++) {
                double fraction = range > 0 ? (spectrogram.get(row, col) - min) / range : 0;
                image.setRGB(col, y, colorMap.getRGB(fraction));
            }
        }
        return image;
    }

    public void write(Spectrogram spectrogram, File file) throws IOException {
        if (!ImageIO.write(render(spectrogram), "png", file)) {
            throw new IOException("No PNG writer available for " + file);
        }
    }
}
