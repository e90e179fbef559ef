package org.sunrise.callisto;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.header.Standard;
import nom.tam.util.BufferedFile;

/**
 * Reads and writes spectrograms stored as the primary image of a FITS file, as
 * produced by e-Callisto stations (optionally gzip compressed).
 */
public class SpectrogramFits {

    private static final Logger LOG = Logger.getLogger(SpectrogramFits.class.getName());

    static {
        FitsFactory.setUseHierarch(true);
    }

    private SpectrogramFits() {
    }

    public static Spectrogram read(File file) throws IOException {
        try (InputStream in = new FileInputStream(file)) {
            return read(in, file.getName());
        }
    }

    /**
     * Read the primary HDU of a FITS stream. {@code BZERO} and {@code BSCALE}
     * are applied, and 8 bit data is treated as unsigned as the FITS standard
     * requires.
     *
     * @param input The stream, which is not closed
     * @param name Name of the source; a name ending in {@code .gz} is
     * decompressed
     * @return The spectrogram
     * @throws IOException If the data cannot be read or is not FITS
     * @throws InvalidShapeException If the primary image is not 2-dimensional
     */
    public static Spectrogram read(InputStream input, String name) throws IOException {
        InputStream stream = new BufferedInputStream(input);
        if (name.endsWith(".gz")) {
            stream = new BufferedInputStream(new GZIPInputStream(stream));
        }
        try {
            Fits fits = new Fits(stream);
            BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null) {
                throw new IOException("No FITS image found in " + name);
            }
            Header header = hdu.getHeader();
            int naxis = header.getIntValue(Standard.NAXIS);
            if (naxis != 2) {
                throw new InvalidShapeException("Expected a 2D image in " + name + " but NAXIS=" + naxis);
            }
            int bitpix = header.getIntValue(Standard.BITPIX);
            double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
            double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
            Spectrogram result = Spectrogram.of(hdu.getKernel(), bitpix == 8, bzero, bscale);
            LOG.log(Level.FINE, "Read {0} from {1} (BITPIX={2})", new Object[]{result, name, bitpix});
            return result;
        } catch (FitsException x) {
            throw new IOException("Error reading FITS data from " + name, x);
        }
    }

    /**
     * Write a spectrogram as a 64 bit floating point primary image, replacing
     * any existing file.
     */
    public static void write(Spectrogram spectrogram, File file) throws IOException {
        Files.deleteIfExists(file.toPath());
        try (Fits fits = new Fits(); BufferedFile bf = new BufferedFile(file, "rw")) {
            fits.addHDU(Fits.makeHDU(spectrogram.toArray()));
            fits.write(bf);
        } catch (FitsException x) {
            throw new IOException("Error writing FITS file " + file, x);
        }
    }
}
