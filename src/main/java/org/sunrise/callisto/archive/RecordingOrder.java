package org.sunrise.callisto.archive;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders e-Callisto recordings by the UTC start time embedded in their names
 * ({@code STATION_YYYYMMDD_HHMMSS_NN.fit.gz}).
 */
public class RecordingOrder {

    private static final Pattern TIME_PATTERN = Pattern.compile("_(\\d{2})(\\d{2})(\\d{2})(?=_)");

    private RecordingOrder() {
    }

    /**
     * Sort recordings by time of day, starting from {@code dayStart} and
     * wrapping around midnight. e-Callisto names are in UTC, so a station's
     * local observing day usually begins part way through the UTC day.
     *
     * @param names Recording names or URLs. Names without an {@code _HHMMSS_}
     * field are dropped.
     * @param dayStart The first recording is the earliest one starting at or
     * after this time. If there is none the list starts at the earliest time.
     * @return The ordered names
     */
    public static List<String> circularSort(List<String> names, LocalTime dayStart) {
        List<Timestamped> timed = new ArrayList<>();
        for (String name : names) {
            LocalTime time = startTime(name);
            if (time != null) {
                timed.add(new Timestamped(time, name));
            }
        }
        timed.sort(Comparator.comparing(Timestamped::getTime));
        int first = 0;
        while (first < timed.size() && timed.get(first).getTime().isBefore(dayStart)) {
            first++;
        }
        if (first == timed.size()) {
            first = 0;
        }
        List<String> result = new ArrayList<>(timed.size());
        for (int i = 0; i < timed.size(); i++) {
            result.add(timed.get((first + i) % timed.size()).getName());
        }
        return result;
    }

    /**
     * @return The start time encoded in the name, or {@code null} if there is
     * none
     */
    static LocalTime startTime(String name) {
        Matcher matcher = TIME_PATTERN.matcher(name);
        while (matcher.find()) {
            int hour = Integer.parseInt(matcher.group(1));
            int minute = Integer.parseInt(matcher.group(2));
            int second = Integer.parseInt(matcher.group(3));
            if (hour < 24 && minute < 60 && second < 60) {
                return LocalTime.of(hour, minute, second);
            }
        }
        return null;
    }

    /**
     * Parse a time of day written as {@code HHMMSS}.
     *
     * @throws IllegalArgumentException If the text is not six digits or not a
     * valid time
     */
    public static LocalTime parseDayStart(String hhmmss) {
        if (!hhmmss.matches("\\d{6}")) {
            throw new IllegalArgumentException("Day start must be HHMMSS: " + hhmmss);
        }
        try {
            return LocalTime.of(Integer.parseInt(hhmmss.substring(0, 2)), Integer.parseInt(hhmmss.substring(2, 4)), Integer.parseInt(hhmmss.substring(4, 6)));
        } catch (DateTimeException x) {
            throw new IllegalArgumentException("Invalid day start: " + hhmmss, x);
        }
    }

    private static class Timestamped {

        private final LocalTime time;
        private final String name;

        Timestamped(LocalTime time, String name) {
            this.time = time;
            this.name = name;
        }

        LocalTime getTime() {
            return time;
        }

        String getName() {
            return name;
        }
    }
}
