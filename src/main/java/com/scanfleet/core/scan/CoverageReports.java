package com.scanfleet.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Locates coverage reports produced by a test phase.
 */
final class CoverageReports {

    private static final Logger log = LoggerFactory.getLogger(CoverageReports.class);

    private static final int MAX_DEPTH = 12;

    private CoverageReports() {}

    /**
     * Finds files named {@code fileName} below {@code root}, outside {@code .git} and
     * {@code node_modules}, as paths relative to {@code root}.
     */
    static List<String> find(Path root, String fileName) {
        try (Stream<Path> stream = Files.walk(root, MAX_DEPTH)) {
            return stream
                    .filter(p -> p.getFileName() != null && fileName.equals(p.getFileName().toString()))
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(p -> !p.startsWith(".git") && !p.toString().contains("node_modules"))
                    .map(p -> p.toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not search {} for {}: {}", root, fileName, e.getMessage());
            return List.of();
        }
    }

    /**
     * Deletes a report left behind by an earlier run in a reused checkout.
     */
    static void removeStale(Path report) {
        try {
            if (Files.deleteIfExists(report)) {
                log.debug("Removed stale coverage report {}", report);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not remove stale coverage report " + report, e);
        }
    }

    /**
     * Deletes every report named {@code fileName} below {@code root}.
     */
    static void removeStale(Path root, String fileName) {
        for (String report : find(root, fileName)) {
            removeStale(root.resolve(report));
        }
    }
}
