package com.scanfleet.core.scanner;

import com.scanfleet.core.model.Category;
import com.scanfleet.core.model.Classification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a repository checkout once and decides its {@link Category}.
 * <p>
 * Extensions are checked in strict priority order: a performance-test plan wins
 * immediately, then any source file wins immediately, while infrastructure-as-code files
 * only set flags so that a later source or test-plan file elsewhere still takes precedence.
 * VCS and tool-cache directories are pruned from the walk; unreadable entries are skipped.
 */
@Service
public class RepositoryClassifier {

    private static final Logger log = LoggerFactory.getLogger(RepositoryClassifier.class);

    /**
     * VCS metadata, dependency and tool caches skipped during the walk. Output-like names
     * such as {@code bin} or {@code build} are walked.
     */
    static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", ".venv", "venv", "__pycache__",
            ".gradle", ".idea", ".vscode", ".scannerwork"
    );

    static final Set<String> PERFORMANCE_TEST_EXTENSIONS = Set.of("jmx");

    static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "kts", "scala", "groovy",
            "cs", "vb", "fs",
            "py", "go", "rb", "php", "pl", "lua", "dart",
            "js", "jsx", "ts", "tsx",
            "c", "h", "cpp", "cc", "hpp", "m", "swift", "rs",
            "sh", "ps1", "sql"
    );

    static final Set<String> YAML_EXTENSIONS = Set.of("yaml", "yml");

    static final Set<String> TERRAFORM_EXTENSIONS = Set.of("tf", "tfvars");

    /**
     * Classifies the given checkout.
     *
     * @param root directory to inspect; a missing directory is {@link Category#EMPTY}
     * @return the category and, for {@link Category#CONFIG}, the infrastructure tags found
     */
    public Classification classify(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("Nothing to classify at {}", root);
            return Classification.of(Category.EMPTY);
        }

        var visitor = new ClassifyingVisitor(root);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException e) {
            // the visitor never rethrows, so this is only reachable if the root itself vanished
            throw new UncheckedIOException("Failed to walk " + root, e);
        }

        Classification result = visitor.result();
        log.info("Classified {} as {} {}", root, result.category(), result.tags());
        return result;
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static final class ClassifyingVisitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private Category decided;
        private boolean yaml;
        private boolean terraform;

        ClassifyingVisitor(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && IGNORE_DIRS.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            String ext = extensionOf(file);
            if (PERFORMANCE_TEST_EXTENSIONS.contains(ext)) {
                decided = Category.PERFORMANCE_TEST;
                return FileVisitResult.TERMINATE;
            }
            if (CODE_EXTENSIONS.contains(ext)) {
                decided = Category.CODE;
                return FileVisitResult.TERMINATE;
            }
            if (YAML_EXTENSIONS.contains(ext)) {
                yaml = true;
            } else if (TERRAFORM_EXTENSIONS.contains(ext)) {
                terraform = true;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("Skipping unreadable entry {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        Classification result() {
            if (decided != null) {
                return Classification.of(decided);
            }
            if (yaml || terraform) {
                var tags = new LinkedHashSet<String>();
                if (yaml) tags.add(Classification.TAG_YAML);
                if (terraform) tags.add(Classification.TAG_TERRAFORM);
                return new Classification(Category.CONFIG, tags);
            }
            return Classification.of(Category.EMPTY);
        }
    }
}
