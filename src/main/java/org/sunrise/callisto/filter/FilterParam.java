package org.sunrise.callisto.filter;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Settings for {@link AdaptiveMedianFilter}. Defaults for the radius and chunk
 * size can be overridden with the system properties
 * {@code org.sunrise.callisto.filter.radius} and
 * {@code org.sunrise.callisto.filter.chunkSize}.
 */
public class FilterParam {

    public static final int DEFAULT_RADIUS = 15;
    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private int radius = Integer.getInteger("org.sunrise.callisto.filter.radius", DEFAULT_RADIUS);
    private int chunkSize = Integer.getInteger("org.sunrise.callisto.filter.chunkSize", DEFAULT_CHUNK_SIZE);
    private BoundaryMode boundaryMode = BoundaryMode.REFLECT;
    private Executor executor;

    public int getRadius() {
        return radius;
    }

    /**
     * @param radius Maximum offset along the sampling line; each pixel gets
     * {@code 2·radius+1} samples
     */
    public void setRadius(int radius) {
        this.radius = radius;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * @param chunkSize Maximum number of time columns sampled at once
     */
    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public BoundaryMode getBoundaryMode() {
        return boundaryMode;
    }

    public void setBoundaryMode(BoundaryMode boundaryMode) {
        this.boundaryMode = Objects.requireNonNull(boundaryMode);
    }

    public Executor getExecutor() {
        return executor;
    }

    /**
     * @param executor Used to process chunks concurrently; {@code null} (the
     * default) processes them one after another on the calling thread
     */
    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    @Override
    public String toString() {
        return "FilterParam{" + "radius=" + radius + ", chunkSize=" + chunkSize + ", boundaryMode=" + boundaryMode + '}';
    }
}
