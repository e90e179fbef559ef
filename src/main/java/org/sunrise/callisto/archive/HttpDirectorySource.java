package org.sunrise.callisto.archive;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads recordings from a web server exposing one directory listing per day,
 * {@code <base>/yyyy/MM/dd/}, such as the public e-Callisto archive.
 */
public class HttpDirectorySource implements RecordingSource {

    public static final String DEFAULT_BASE_URL = "https://soleil.i4ds.ch/solarradio/data/2002-20yy_Callisto/";
    private static final Pattern HREF_PATTERN = Pattern.compile("href\\s*=\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);

    private static final Logger LOG = Logger.getLogger(HttpDirectorySource.class.getName());

    private final URI base;

    public HttpDirectorySource() {
        this(URI.create(System.getProperty("org.sunrise.callisto.archive.baseURL", DEFAULT_BASE_URL)));
    }

    public HttpDirectorySource(URI base) {
        String s = base.toString();
        this.base = s.endsWith("/") ? base : URI.create(s + "/");
    }

    @Override
    public List<String> list(LocalDate date) throws IOException {
        URI day = dayURI(date);
        LOG.log(Level.FINE, "Listing {0}", day);
        String html;
        try (InputStream in = day.toURL().openStream()) {
            html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return parseLinks(day, html);
    }

    @Override
    public InputStream open(String name) throws IOException {
        return URI.create(name).toURL().openStream();
    }

    URI dayURI(LocalDate date) {
        return base.resolve(String.format("%04d/%02d/%02d/", date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
    }

    /**
     * Extract the link targets of a directory listing, resolved against the
     * directory. Links to the parent or the directory itself are skipped.
     */
    static List<String> parseLinks(URI directory, String html) {
        List<String> result = new ArrayList<>();
        Matcher matcher = HREF_PATTERN.matcher(html);
        while (matcher.find()) {
            String href = matcher.group(1);
            if ("../".equals(href) || "./".equals(href)) {
                continue;
            }
            result.add(directory.resolve(href).toString());
        }
        return result;
    }

    @Override
    public String toString() {
        return "HttpDirectorySource{" + "base=" + base + '}';
    }
}
