package org.sunrise.callisto.archive;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import org.sunrise.callisto.Spectrogram;
import org.sunrise.callisto.SpectrogramFits;
import org.sunrise.callisto.Timed;

/**
 * Assembles the recordings of one station for one day into a single
 * spectrogram. Day listings and decoded recordings are cached with Caffeine, so
 * repeated requests (for example for neighbouring stations on the same day) do
 * not hit the archive again, and recordings are fetched concurrently.
 */
public class CallistoArchive {

    private static final Logger LOG = Logger.getLogger(CallistoArchive.class.getName());

    /**
     * About 400 MB of decoded samples, or some seventy 200 x 3600 recordings.
     */
    public static final long DEFAULT_RECORDING_CACHE_SAMPLES = 50_000_000L;

    private final RecordingSource source;
    private final LoadingCache<LocalDate, List<String>> listingCache;
    private final AsyncLoadingCache<String, Spectrogram> recordingCache;

    public CallistoArchive() {
        this(new HttpDirectorySource());
    }

    public CallistoArchive(RecordingSource source) {
        this(source, Long.getLong("org.sunrise.callisto.archive.recordingCacheSamples", DEFAULT_RECORDING_CACHE_SAMPLES));
    }

    /**
     * @param source Where recordings are listed and read from
     * @param recordingCacheSamples Total number of samples (frequency bins x
     * time steps) of decoded recordings kept in memory
     */
    public CallistoArchive(RecordingSource source, long recordingCacheSamples) {
        this.source = source;

        listingCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.sunrise.callisto.archive.listingCacheSize", 100))
                .recordStats()
                .build((LocalDate date) -> {
                    return Timed.execute(() -> source.list(date), "Listing %s took %dms", date);
                });

        recordingCache = Caffeine.newBuilder()
                .maximumWeight(recordingCacheSamples)
                .weigher((String name, Spectrogram recording) -> weigh(recording))
                .recordStats()
                .buildAsync((String name) -> {
                    return Timed.execute(() -> readRecording(name), "Loading %s took %dms", name);
                });
    }

    /**
     * Build the spectrogram of one station for one day.
     *
     * @param station Station name, matched as a substring of the recording
     * names
     * @param date The UTC date
     * @param dayStart UTC time at which the station's day starts; recordings
     * are ordered from here, wrapping around midnight
     * @return All recordings concatenated along time, with frequency increasing
     * with row index
     * @throws IOException If nothing was found or a recording cannot be read
     * @throws org.sunrise.callisto.InvalidShapeException If the recordings do
     * not all have the same number of frequency bins
     */
    public Spectrogram oneDay(String station, LocalDate date, LocalTime dayStart) throws IOException {
        List<String> names;
        try {
            names = listingCache.get(date);
        } catch (CompletionException x) {
            throw unwrap(x);
        }
        List<String> stationNames = names.stream()
                .filter((name) -> name.contains(station))
                .collect(Collectors.toList());
        List<String> ordered = RecordingOrder.circularSort(stationNames, dayStart);
        if (ordered.isEmpty()) {
            throw new IOException("No recordings found for " + station + " on " + date);
        }
        LOG.log(Level.INFO, "Loading {0} recordings for {1} on {2}", new Object[]{ordered.size(), station, date});

        List<CompletableFuture<Spectrogram>> futures = new ArrayList<>();
        for (String name : ordered) {
            futures.add(recordingCache.get(name));
        }
        List<Spectrogram> parts = new ArrayList<>();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()])).join();
            for (CompletableFuture<Spectrogram> future : futures) {
                parts.add(future.join());
            }
        } catch (CompletionException x) {
            throw unwrap(x);
        }
        report();
        // Recordings store the highest frequency in the first row
        return Spectrogram.concatenate(parts).flipRows();
    }

    private Spectrogram readRecording(String name) throws IOException {
        try (InputStream in = source.open(name)) {
            return SpectrogramFits.read(in, name);
        }
    }

    private static IOException unwrap(CompletionException x) {
        Throwable cause = x.getCause();
        if (cause instanceof IOException io) {
            return io;
        } else if (cause instanceof RuntimeException runtime) {
            throw runtime;
        } else {
            return new IOException("Unexpected exception while reading recordings", cause);
        }
    }

    static int weigh(Spectrogram recording) {
        return (int) Math.min(Integer.MAX_VALUE, (long) recording.getRows() * recording.getColumns());
    }

    /**
     * @return The number of decoded recordings currently cached
     */
    long cachedRecordings() {
        LoadingCache<String, Spectrogram> recordings = recordingCache.synchronous();
        recordings.cleanUp();
        return recordings.estimatedSize();
    }

    void report() {
        LOG.log(Level.FINE, "listing Cache size {0} stats {1}", new Object[]{listingCache.estimatedSize(), listingCache.stats()});
        LoadingCache<String, Spectrogram> recordings = recordingCache.synchronous();
        LOG.log(Level.FINE, "recording Cache size {0} stats {1}", new Object[]{recordings.estimatedSize(), recordings.stats()});
    }

    public RecordingSource getSource() {
        return source;
    }
}
