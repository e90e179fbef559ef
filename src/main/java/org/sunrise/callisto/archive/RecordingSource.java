package org.sunrise.callisto.archive;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;

/**
 * Somewhere e-Callisto recordings can be found, organised by day.
 */
public interface RecordingSource {

    /**
     * @param date The UTC date
     * @return Names (for all stations) of the recordings for that day, in any
     * order. Each name can be passed to {@link #open(String)}.
     */
    List<String> list(LocalDate date) throws IOException;

    InputStream open(String name) throws IOException;
}
