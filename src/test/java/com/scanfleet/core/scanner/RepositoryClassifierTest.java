package com.scanfleet.core.scanner;

import com.scanfleet.core.model.Category;
import com.scanfleet.core.model.Classification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RepositoryClassifier}.
 * <p>
 * Uses JUnit 5's {@code @TempDir} so each tree is built from scratch.
 */
class RepositoryClassifierTest {

    @TempDir
    Path tempDir;

    RepositoryClassifier classifier = new RepositoryClassifier();

    private void write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    // =====================================================================
    //  Empty
    // =====================================================================

    @Test
    @DisplayName("empty directory is EMPTY with no tags")
    void emptyDirectory() {
        var result = classifier.classify(tempDir);
        assertEquals(Category.EMPTY, result.category());
        assertTrue(result.tags().isEmpty());
    }

    @Test
    @DisplayName("only unrecognised files is EMPTY")
    void unrecognisedFilesOnly() throws IOException {
        write("README.md");
        write("LICENSE");
        write("docs/logo.png");

        var result = classifier.classify(tempDir);
        assertEquals(Category.EMPTY, result.category());
        assertTrue(result.tags().isEmpty());
    }

    @Test
    @DisplayName("missing directory is EMPTY")
    void missingDirectory() {
        assertEquals(Category.EMPTY, classifier.classify(tempDir.resolve("nope")).category());
    }

    // =====================================================================
    //  Code
    // =====================================================================

    @Test
    @DisplayName("a single source file makes the repository CODE")
    void sourceFileIsCode() throws IOException {
        write("main.go");
        write("go.mod");
        assertEquals(Category.CODE, classifier.classify(tempDir).category());
    }

    @Test
    @DisplayName("code wins over config files anywhere in the tree")
    void codeWinsOverConfig() throws IOException {
        write("deploy/values.yaml");
        write("infra/main.tf");
        write("src/deep/nested/app.py");

        var result = classifier.classify(tempDir);
        assertEquals(Category.CODE, result.category());
        assertTrue(result.tags().isEmpty());
    }

    // =====================================================================
    //  Performance test
    // =====================================================================

    @Test
    @DisplayName("a test plan is PERFORMANCE_TEST")
    void testPlanIsPerformanceTest() throws IOException {
        write("plan.jmx");
        assertEquals(Category.PERFORMANCE_TEST, classifier.classify(tempDir).category());
    }

    @Test
    @DisplayName("performance test wins over source files")
    void performanceTestWinsOverCode() throws IOException {
        write("a/Helper.java");
        write("b/c/load.jmx");
        write("z/script.groovy");

        assertEquals(Category.PERFORMANCE_TEST, classifier.classify(tempDir).category());
    }

    // =====================================================================
    //  Config
    // =====================================================================

    @Test
    @DisplayName("yaml only is CONFIG tagged yaml")
    void yamlOnly() throws IOException {
        write("k8s/deployment.yml");
        write("k8s/service.yaml");

        var result = classifier.classify(tempDir);
        assertEquals(Category.CONFIG, result.category());
        assertEquals(Set.of(Classification.TAG_YAML), result.tags());
    }

    @Test
    @DisplayName("terraform only is CONFIG tagged terraform")
    void terraformOnly() throws IOException {
        write("main.tf");
        write("prod.tfvars");

        var result = classifier.classify(tempDir);
        assertEquals(Category.CONFIG, result.category());
        assertEquals(Set.of(Classification.TAG_TERRAFORM), result.tags());
    }

    @Test
    @DisplayName("yaml and terraform together carry both tags")
    void yamlAndTerraform() throws IOException {
        write("main.tf");
        write(".github/workflows/ci.yaml");
        write("README.md");

        var result = classifier.classify(tempDir);
        assertEquals(Category.CONFIG, result.category());
        assertEquals(Set.of(Classification.TAG_YAML, Classification.TAG_TERRAFORM), result.tags());
    }

    // =====================================================================
    //  Ignored directories
    // =====================================================================

    @Test
    @DisplayName("sources inside ignored directories do not count")
    void ignoresToolDirectories() throws IOException {
        write("node_modules/lib/index.js");
        write(".git/hooks/pre-commit.sh");
        write(".venv/lib/site.py");
        write("__pycache__/mod.py");
        write("config.yaml");

        var result = classifier.classify(tempDir);
        assertEquals(Category.CONFIG, result.category());
    }

    @Test
    @DisplayName("sources under bin and build directories count as code")
    void outputLikeDirectoriesAreWalked() throws IOException {
        write("bin/deploy.sh");
        write("build/release.py");

        assertEquals(Category.CODE, classifier.classify(tempDir).category());
    }

    @Test
    @DisplayName("test plans under dist and vendor directories are found")
    void distAndVendorAreWalked() throws IOException {
        write("dist/load/checkout.jmx");
        write("vendor/tools/values.yaml");

        assertEquals(Category.PERFORMANCE_TEST, classifier.classify(tempDir).category());
    }

    @Test
    @DisplayName("extension matching is case-insensitive")
    void caseInsensitiveExtensions() throws IOException {
        write("Program.CS");
        assertEquals(Category.CODE, classifier.classify(tempDir).category());
    }

    @Test
    void extensionOf() {
        assertEquals("yml", RepositoryClassifier.extensionOf(Path.of("a/b.YML")));
        assertEquals("", RepositoryClassifier.extensionOf(Path.of("Makefile")));
        assertEquals("", RepositoryClassifier.extensionOf(Path.of(".gitignore")));
        assertEquals("", RepositoryClassifier.extensionOf(Path.of("trailing.")));
    }
}
