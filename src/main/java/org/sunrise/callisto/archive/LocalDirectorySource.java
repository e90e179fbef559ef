package org.sunrise.callisto.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recordings already downloaded into a local tree laid out like the archive,
 * {@code <root>/yyyy/MM/dd/}.
 */
public class LocalDirectorySource implements RecordingSource {

    private final Path root;

    public LocalDirectorySource(Path root) {
        this.root = root;
    }

    @Override
    public List<String> list(LocalDate date) throws IOException {
        Path day = root.resolve(String.format("%04d", date.getYear()))
                .resolve(String.format("%02d", date.getMonthValue()))
                .resolve(String.format("%02d", date.getDayOfMonth()));
        if (!Files.isDirectory(day)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(day)) {
            return files.filter(Files::isRegularFile).map(Path::toString).sorted().collect(Collectors.toList());
        }
    }

    @Override
    public InputStream open(String name) throws IOException {
        return Files.newInputStream(Paths.get(name));
    }

    @Override
    public String toString() {
        return "LocalDirectorySource{" + "root=" + root + '}';
    }
}
