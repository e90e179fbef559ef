package org.sunrise.callisto.cmap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an SAO colormap file (as read/written by ds9) from the classpath.
 * Only the {@code PSEUDOCOLOR} scheme is supported: for each of red, green and
 * blue a list of {@code (position,intensity)} control points, both in
 * {@code [0, 1]}, with linear interpolation in between.
 */
public class SAOColorMap extends RGBColorMap {

    private static final Pattern COORD_PATTERN = Pattern.compile("\\(\\s*([0-9.eE+-]+)\\s*,\\s*([0-9.eE+-]+)\\s*\\)");
    private final int[] rgb;
    private final String name;

    private enum ColorScheme {
        PSEUDOCOLOR
    };

    private enum Color {
        RED, GREEN, BLUE
    };

    /**
     * @param size Number of entries in the table
     * @param colorMap Resource name relative to this class, e.g.
     * {@code "viridis.sao"}
     */
    public SAOColorMap(int size, String colorMap) {
        super(size);
        this.name = colorMap;
        try (InputStream input = SAOColorMap.class.getResourceAsStream(colorMap)) {
            if (input == null) {
                throw new RuntimeException("Missing sao file: " + colorMap);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
            String schemeLine = nextLine(reader);
            if (schemeLine == null) {
                throw new RuntimeException("Empty colormap " + colorMap);
            }
            ColorScheme colorScheme = ColorScheme.valueOf(schemeLine.toUpperCase());
            switch (colorScheme) {
                case PSEUDOCOLOR:
                    rgb = convertToCMap(size, readChannels(reader, colorMap));
                    break;
                default:
                    throw new RuntimeException("Unsupported color scheme: " + colorScheme);
            }
        } catch (IOException | IllegalArgumentException x) {
            throw new RuntimeException("Invalid colormap " + colorMap, x);
        }
    }

    private static Map<Color, Interpolation> readChannels(BufferedReader reader, String colorMap) throws IOException {
        Map<Color, Interpolation> cmap = new EnumMap<>(Color.class);
        Interpolation current = null;
        for (String line = nextLine(reader); line != null; line = nextLine(reader)) {
            if (line.endsWith(":")) {
                current = new Interpolation();
                cmap.put(Color.valueOf(line.substring(0, line.length() - 1).trim().toUpperCase()), current);
            } else if (current == null) {
                throw new IOException("Control points before any colour in " + colorMap);
            } else {
                current.readPoints(line);
            }
        }
        for (Color color : Color.values()) {
            Interpolation channel = cmap.get(color);
            if (channel == null || channel.isEmpty()) {
                throw new IOException("Missing " + color + " channel in " + colorMap);
            }
        }
        return cmap;
    }

    @Override
    public int getRGB(int index) {
        return rgb[index];
    }

    public String getName() {
        return name;
    }

    private static int[] convertToCMap(int size, Map<Color, Interpolation> cmap) {
        int[] rgb = new int[size];
        for (int i = 0; i < size; i++) {
            float f = size == 1 ? 0 : i / (size - 1.0f);
            rgb[i] = channel(cmap.get(Color.RED).get(f)) << 16
                    | channel(cmap.get(Color.GREEN).get(f)) << 8
                    | channel(cmap.get(Color.BLUE).get(f));
        }
        return rgb;
    }

    private static int channel(float intensity) {
        return Math.max(0, Math.min(255, Math.round(255 * intensity)));
    }

    // Skips blank lines and # comments
    private static String nextLine(BufferedReader reader) throws IOException {
        for (;;) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            String commentRemoved = line.split("#", 2)[0].trim();
            if (!commentRemoved.isEmpty()) {
                return commentRemoved;
            }
        }
    }

    private static class Interpolation {

        private final List<Float> x = new ArrayList<>();
        private final List<Float> y = new ArrayList<>();

        boolean isEmpty() {
            return x.isEmpty();
        }

        float get(float value) {
            int last = x.size() - 1;
            if (value <= x.get(0)) {
                return y.get(0);
            }
            if (value >= x.get(last)) {
                return y.get(last);
            }
            int i = 1;
            while (x.get(i) < value) {
                i++;
            }
            float x1 = x.get(i - 1);
            float x2 = x.get(i);
            float y1 = y.get(i - 1);
            float y2 = y.get(i);
            return x2 == x1 ? y2 : y1 + (y2 - y1) * (value - x1) / (x2 - x1);
        }

        void readPoints(String line) throws IOException {
            Matcher matcher = COORD_PATTERN.matcher(line);
            boolean found = false;
            while (matcher.find()) {
                float f1 = Float.parseFloat(matcher.group(1));
                float f2 = Float.parseFloat(matcher.group(2));
                if (!x.isEmpty() && f1 < x.get(x.size() - 1)) {
                    throw new IOException("Control points out of order: " + line);
                }
                x.add(f1);
                y.add(f2);
                found = true;
            }
            if (!found) {
                throw new IOException("Invalid control points: " + line);
            }
        }
    }
}
