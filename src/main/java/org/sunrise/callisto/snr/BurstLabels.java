package org.sunrise.callisto.snr;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads burst labels from a text file with one {@code label,start,end} entry
 * per line. Blank lines and anything after a {@code #} are ignored.
 */
public class BurstLabels {

    private static final Pattern LINE_PATTERN = Pattern.compile("(.*?)\\s*,\\s*(-?\\d+)\\s*,\\s*(-?\\d+)");

    private BurstLabels() {
    }

    public static List<BurstLabel> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static List<BurstLabel> read(InputStream input) throws IOException {
        List<BurstLabel> result = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        int lineNumber = 0;
        for (;;) {
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            lineNumber++;
            String content = line.split("#", 2)[0].trim();
            if (content.isEmpty()) {
                continue;
            }
            Matcher matcher = LINE_PATTERN.matcher(content);
            if (!matcher.matches()) {
                throw new IOException("Invalid burst label at line " + lineNumber + ": " + line);
            }
            try {
                result.add(new BurstLabel(matcher.group(1), Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(3))));
            } catch (NumberFormatException x) {
                throw new IOException("Invalid index at line " + lineNumber + ": " + line, x);
            }
        }
        return result;
    }
}
