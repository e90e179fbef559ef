package org.sunrise.callisto.filter;

import java.util.Arrays;
import org.sunrise.callisto.InvalidParameterException;

/**
 * Reduces the samples taken along a line to their median. The number of
 * samples is always odd, so the median is a single middle element and never an
 * average of two.
 *
 * <p>
 * Samples are ordered as by {@link Double#compare}, so NaN sorts above positive
 * infinity. A NaN sample therefore does not poison the result: the median is
 * NaN only when NaN lands on the middle element, i.e. when more than half of
 * the samples are NaN.
 */
public class KernelAggregator {

    /**
     * @param samples An odd number of samples, left unmodified
     * @return The median
     */
    public double aggregate(double[] samples) {
        return aggregate(samples.clone(), 0, samples.length);
    }

    /**
     * Median of {@code arena[offset .. offset+length)}. The slice is sorted in
     * place.
     *
     * @param arena Sample storage shared by a whole chunk
     * @param offset Start of this pixel's samples
     * @param length Number of samples, must be odd
     * @return The median
     */
    public double aggregate(double[] arena, int offset, int length) {
        if (length % 2 == 0) {
            throw new InvalidParameterException("Median needs an odd number of samples, got " + length);
        }
        Arrays.sort(arena, offset, offset + length);
        return arena[offset + length / 2];
    }
}
