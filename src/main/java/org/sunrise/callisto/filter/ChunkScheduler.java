package org.sunrise.callisto.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.sunrise.callisto.InvalidParameterException;
import org.sunrise.callisto.InvalidShapeException;
import org.sunrise.callisto.Spectrogram;
import org.sunrise.callisto.Timed;

/**
 * Runs the directional median over a spectrogram a block of time columns at a
 * time. Within a chunk samples are gathered one row at a time, in blocks of
 * columns small enough that the sample stack stays bounded whatever the chunk
 * size. Every chunk reads the complete input and orientation field, so the
 * output does not depend on where the chunk boundaries fall.
 */
public class ChunkScheduler {

    private static final Logger LOG = Logger.getLogger(ChunkScheduler.class.getName());

    /**
     * Largest number of samples held in one stack, unless a single pixel's
     * line needs more.
     */
    static final int MAX_STACK_SAMPLES = 1 << 20;
    /**
     * Largest radius whose {@code 2·radius+1} samples fit in one array.
     */
    public static final int MAX_RADIUS = (Integer.MAX_VALUE - 9) / 2;

    private final DirectionalSampler sampler;
    private final KernelAggregator aggregator;
    private final int radius;
    private final int chunkSize;
    private final Executor executor;

    /**
     * @param sampler Source of directional samples
     * @param aggregator Reduction applied to each pixel's samples
     * @param radius Samples are taken at offsets {@code -radius..radius}
     * @param chunkSize Maximum number of columns per chunk
     * @param executor Runs chunks concurrently, or {@code null} to run them in
     * order on the calling thread
     */
    public ChunkScheduler(DirectionalSampler sampler, KernelAggregator aggregator, int radius, int chunkSize, Executor executor) {
        if (radius < 0 || radius > MAX_RADIUS) {
            throw new InvalidParameterException("radius must be in 0.." + MAX_RADIUS + ": " + radius);
        }
        if (chunkSize <= 0) {
            throw new InvalidParameterException("chunkSize must be positive: " + chunkSize);
        }
        this.sampler = sampler;
        this.aggregator = aggregator;
        this.radius = radius;
        this.chunkSize = chunkSize;
        this.executor = executor;
    }

    public Spectrogram run(Spectrogram input, OrientationField orientation) {
        int nRows = input.getRows();
        int nCols = input.getColumns();
        if (orientation.getRows() != nRows || orientation.getColumns() != nCols) {
            throw new InvalidShapeException("Orientation field " + orientation.getRows() + "x" + orientation.getColumns()
                    + " does not match spectrogram " + nRows + "x" + nCols);
        }
        double[][] sin = new double[nRows][nCols];
        double[][] cos = new double[nRows][nCols];
        for (int r = 0; r < nRows; r++) {
            for (int c = 0; c < nCols; c++) {
                double theta = orientation.get(r, c);
                sin[r][c] = Math.sin(theta);
                cos[r][c] = Math.cos(theta);
            }
        }
        double[][] output = new double[nRows][nCols];
        List<Chunk> chunks = partition(nCols, chunkSize);
        LOG.log(Level.FINE, "Filtering {0} in {1} chunks of up to {2} columns", new Object[]{input, chunks.size(), chunkSize});

        if (executor == null) {
            for (Chunk chunk : chunks) {
                process(input, sin, cos, chunk, output);
            }
        } else {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (Chunk chunk : chunks) {
                futures.add(CompletableFuture.runAsync(() -> process(input, sin, cos, chunk, output), executor));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()])).join();
            } catch (CompletionException x) {
                Throwable cause = x.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                } else if (cause instanceof Error error) {
                    throw error;
                } else {
                    throw new IllegalStateException("Unexpected exception while filtering", cause);
                }
            }
        }
        return Spectrogram.wrap(output);
    }

    private void process(Spectrogram input, double[][] sin, double[][] cos, Chunk chunk, double[][] output) {
        Timed.run(() -> {
            int window = 2 * radius + 1;
            int block = blockColumns(chunk.getWidth(), window);
            // Samples for up to block columns of one row, [column][k] flattened
            double[] stack = new double[block * window];
            for (int r = 0; r < input.getRows(); r++) {
                for (int first = chunk.getFirstColumn(); first < chunk.getEndColumn(); first += block) {
                    int end = Math.min(first + block, chunk.getEndColumn());
                    int position = 0;
                    for (int c = first; c < end; c++) {
                        sampler.sampleLine(input, r, c, sin[r][c], cos[r][c], radius, stack, position);
                        position += window;
                    }
                    position = 0;
                    for (int c = first; c < end; c++) {
                        output[r][c] = aggregator.aggregate(stack, position, window);
                        position += window;
                    }
                }
            }
        }, "Chunk %s took %dms", chunk);
    }

    /**
     * Number of columns whose sample lines share one stack, so that the stack
     * never holds more than {@link #MAX_STACK_SAMPLES} samples unless a single
     * line is longer than that.
     */
    static int blockColumns(int width, int window) {
        return Math.max(1, Math.min(width, MAX_STACK_SAMPLES / window));
    }

    /**
     * Split {@code columns} into contiguous chunks of at most {@code chunkSize}.
     */
    static List<Chunk> partition(int columns, int chunkSize) {
        List<Chunk> result = new ArrayList<>();
        for (int first = 0; first < columns; first += chunkSize) {
            result.add(new Chunk(first, Math.min(chunkSize, columns - first)));
        }
        return result;
    }

    public int getRadius() {
        return radius;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * A contiguous block of time columns.
     */
    static class Chunk {

        private final int firstColumn;
        private final int width;

        Chunk(int firstColumn, int width) {
            this.firstColumn = firstColumn;
            this.width = width;
        }

        int getFirstColumn() {
            return firstColumn;
        }

        int getWidth() {
            return width;
        }

        int getEndColumn() {
            return firstColumn + width;
        }

        @Override
        public String toString() {
            return "Chunk{" + "columns=" + firstColumn + ".." + (getEndColumn() - 1) + '}';
        }
    }
}
