package com.scanfleet.core.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the newline-delimited {@code prefix,repository-url} list.
 * Blank lines and lines without a separator are skipped with a warning.
 */
@Component
public class RepositoryListParser {

    private static final Logger log = LoggerFactory.getLogger(RepositoryListParser.class);

    public List<RepositoryEntry> parse(Path file) throws IOException {
        return parseLines(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public List<RepositoryEntry> parseLines(List<String> lines) {
        var entries = new ArrayList<RepositoryEntry>();
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            String line = lines.get(i).strip();
            if (line.startsWith("#")) {
                continue;
            }
            if (line.isEmpty()) {
                log.warn("Skipping blank line {}", lineNumber);
                continue;
            }
            int comma = line.indexOf(',');
            if (comma < 0) {
                log.warn("Skipping line {} without ',' separator: {}", lineNumber, line);
                continue;
            }
            String prefix = line.substring(0, comma).strip();
            String url = RepositoryUrls.normalize(line.substring(comma + 1));
            if (prefix.isEmpty() || url.isEmpty()) {
                log.warn("Skipping incomplete line {}: {}", lineNumber, line);
                continue;
            }
            entries.add(new RepositoryEntry(prefix, url, RepositoryUrls.repositoryName(url), lineNumber));
        }
        return entries;
    }
}
