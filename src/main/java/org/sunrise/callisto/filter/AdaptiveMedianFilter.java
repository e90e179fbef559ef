package org.sunrise.callisto.filter;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.sunrise.callisto.Spectrogram;
import org.sunrise.callisto.Timed;

/**
 * Adaptive (directional) median filter for radio spectrograms.
 *
 * <p>
 * For every pixel the filter finds the direction along which intensity changes
 * least (perpendicular to the Sobel gradient), samples the spectrogram at
 * {@code 2·radius+1} evenly spaced points along that direction, and replaces the
 * pixel with the median of those samples. Broadband noise running across the
 * gradient is removed while narrowband bursts, which lie along the sampling
 * line, survive.
 *
 * <p>
 * The orientation field is computed once from the unmodified input; sampling is
 * then done in chunks of time columns by a {@link ChunkScheduler}.
 *
 * @see <a href="https://www.swsc-journal.org/articles/swsc/pdf/2018/01/swsc170092.pdf">Space
 * Weather and Space Climate 8, A2 (2018)</a>
 */
public class AdaptiveMedianFilter {

    private static final Logger LOG = Logger.getLogger(AdaptiveMedianFilter.class.getName());

    private final GradientEstimator gradientEstimator;
    private final ChunkScheduler scheduler;

    public AdaptiveMedianFilter() {
        this(new FilterParam());
    }

    /**
     * @param param The settings, copied at construction
     * @throws org.sunrise.callisto.InvalidParameterException If the radius is
     * negative or the chunk size is not positive
     */
    public AdaptiveMedianFilter(FilterParam param) {
        BoundaryMode mode = param.getBoundaryMode();
        this.gradientEstimator = new GradientEstimator(mode);
        this.scheduler = new ChunkScheduler(new DirectionalSampler(mode), new KernelAggregator(),
                param.getRadius(), param.getChunkSize(), param.getExecutor());
        LOG.log(Level.FINE, "Created filter with {0}", param);
    }

    public Spectrogram filter(Spectrogram input) {
        OrientationField orientation = Timed.execute(() -> gradientEstimator.computeOrientation(input),
                "Orientation of %s took %dms", input);
        return Timed.execute(() -> scheduler.run(input, orientation), "Filtering %s took %dms", input);
    }

    /**
     * Convenience for filtering a raw array.
     *
     * @param input A 2D numeric array, [frequency][time]
     * @return The filtered spectrogram
     * @throws org.sunrise.callisto.InvalidShapeException If the input is not a
     * non-empty rectangular 2D array
     */
    public Spectrogram filter(Object input) {
        if (input instanceof Spectrogram spectrogram) {
            return filter(spectrogram);
        }
        return filter(Spectrogram.of(input));
    }

    public static Spectrogram filter(Spectrogram input, int radius, int chunkSize) {
        FilterParam param = new FilterParam();
        param.setRadius(radius);
        param.setChunkSize(chunkSize);
        return new AdaptiveMedianFilter(param).filter(input);
    }
}
