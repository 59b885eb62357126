package com.scanfleet.core.scanner;

import com.scanfleet.core.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Picks the scan pipeline for a repository already classified as code.
 * <p>
 * Markers are checked strongest first: a Java build descriptor at the root, then .NET
 * solution/project files or C#, VB.NET and F# sources anywhere, then Python sources, then
 * Go modules or sources.
 * Anything else goes to the generic sources-only pipeline.
 */
@Service
public class EcosystemDetector {

    private static final Logger log = LoggerFactory.getLogger(EcosystemDetector.class);

    static final Set<String> JAVA_BUILD_DESCRIPTORS = Set.of("pom.xml", "build.gradle", "build.gradle.kts");

    static final Set<String> DOTNET_PROJECT_EXTENSIONS = Set.of("sln", "csproj", "vbproj", "fsproj");

    static final Set<String> DOTNET_SOURCE_EXTENSIONS = Set.of("cs", "vb", "fs");

    public Ecosystem detect(Path root) {
        Ecosystem ecosystem = doDetect(root);
        log.info("Detected {} ecosystem in {}", ecosystem, root);
        return ecosystem;
    }

    private Ecosystem doDetect(Path root) {
        for (String descriptor : JAVA_BUILD_DESCRIPTORS) {
            if (Files.isRegularFile(root.resolve(descriptor))) {
                return Ecosystem.JAVA;
            }
        }
        if (containsFile(root, f -> {
            String ext = RepositoryClassifier.extensionOf(f);
            return DOTNET_PROJECT_EXTENSIONS.contains(ext) || DOTNET_SOURCE_EXTENSIONS.contains(ext);
        })) {
            return Ecosystem.DOTNET;
        }
        if (containsFile(root, f -> "py".equals(RepositoryClassifier.extensionOf(f)))) {
            return Ecosystem.PYTHON;
        }
        if (containsFile(root, f -> "go.mod".equals(f.getFileName().toString())
                || "go".equals(RepositoryClassifier.extensionOf(f)))) {
            return Ecosystem.GO;
        }
        return Ecosystem.GENERIC;
    }

    /**
     * Returns {@code true} if any regular file under {@code root} (outside ignored
     * directories) matches the predicate. Shared with the pipelines that need to look for
     * build markers.
     */
    public static boolean containsFile(Path root, Predicate<Path> matcher) {
        var found = new AtomicBoolean();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root)
                            && RepositoryClassifier.IGNORE_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && matcher.test(file)) {
                        found.set(true);
                        return FileVisitResult.TERMINATE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.debug("Marker search under {} failed: {}", root, e.getMessage());
        }
        return found.get();
    }
}
