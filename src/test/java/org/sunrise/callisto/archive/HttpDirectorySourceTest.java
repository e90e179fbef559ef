package org.sunrise.callisto.archive;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class HttpDirectorySourceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDayURI() {
        HttpDirectorySource source = new HttpDirectorySource(URI.create("https://example.org/callisto"));
        assertEquals(URI.create("https://example.org/callisto/2023/01/05/"), source.dayURI(LocalDate.of(2023, 1, 5)));
    }

    @Test
    public void testDefaultBase() {
        HttpDirectorySource source = new HttpDirectorySource();
        assertEquals(URI.create(HttpDirectorySource.DEFAULT_BASE_URL + "2017/09/10/"), source.dayURI(LocalDate.of(2017, 9, 10)));
    }

    @Test
    public void testParseLinks() {
        URI day = URI.create("https://example.org/callisto/2023/01/05/");
        String html = "<html><body><h1>Index of /callisto/2023/01/05</h1>\n"
                + "<a href=\"../\">Parent Directory</a>\n"
                + "<a href=\"ALASKA_20230105_130000_01.fit.gz\">ALASKA_20230105_130000_01.fit.gz</a>\n"
                + "<A HREF='GLASGOW_20230105_081500_59.fit.gz'>GLASGOW_20230105_081500_59.fit.gz</A>\n"
                + "</body></html>";
        List<String> links = HttpDirectorySource.parseLinks(day, html);
        assertEquals(Arrays.asList(
                "https://example.org/callisto/2023/01/05/ALASKA_20230105_130000_01.fit.gz",
                "https://example.org/callisto/2023/01/05/GLASGOW_20230105_081500_59.fit.gz"), links);
    }

    @Test
    public void testOpen() throws IOException {
        File file = folder.newFile("recording.fit");
        Files.write(file.toPath(), new byte[]{1, 2, 3});
        try (InputStream in = new HttpDirectorySource().open(file.toURI().toString())) {
            assertArrayEquals(new byte[]{1, 2, 3}, in.readAllBytes());
        }
    }
}
