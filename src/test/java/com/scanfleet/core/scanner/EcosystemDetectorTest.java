package com.scanfleet.core.scanner;

import com.scanfleet.core.model.Ecosystem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EcosystemDetectorTest {

    @TempDir
    Path tempDir;

    EcosystemDetector detector = new EcosystemDetector();

    private void write(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    @Test
    @DisplayName("pom.xml at the root selects JAVA even with other sources present")
    void mavenAtRootWins() throws IOException {
        write("pom.xml");
        write("tools/Build.cs");
        write("scripts/release.py");
        write("cmd/main.go");
        assertEquals(Ecosystem.JAVA, detector.detect(tempDir));
    }

    @Test
    @DisplayName("build.gradle.kts at the root selects JAVA")
    void gradleKtsAtRoot() throws IOException {
        write("build.gradle.kts");
        write("scripts/helper.py");
        assertEquals(Ecosystem.JAVA, detector.detect(tempDir));
    }

    @Test
    @DisplayName("a nested pom.xml is not a root build descriptor")
    void nestedPomIsNotJava() throws IOException {
        write("sub/pom.xml");
        write("sub/app.py");
        assertEquals(Ecosystem.PYTHON, detector.detect(tempDir));
    }

    @Test
    @DisplayName("solution file anywhere selects DOTNET")
    void solutionSelectsDotnet() throws IOException {
        write("src/App.sln");
        write("tools/gen.py");
        assertEquals(Ecosystem.DOTNET, detector.detect(tempDir));
    }

    @Test
    @DisplayName("C# sources without a project file select DOTNET")
    void csharpSourcesSelectDotnet() throws IOException {
        write("Scripts/Thing.cs");
        assertEquals(Ecosystem.DOTNET, detector.detect(tempDir));
    }

    @Test
    @DisplayName("python sources select PYTHON ahead of Go")
    void pythonBeforeGo() throws IOException {
        write("main.go");
        write("hack/gen.py");
        assertEquals(Ecosystem.PYTHON, detector.detect(tempDir));
    }

    @Test
    @DisplayName("go.mod selects GO")
    void goModSelectsGo() throws IOException {
        write("go.mod");
        write("main.go");
        assertEquals(Ecosystem.GO, detector.detect(tempDir));
    }

    @Test
    @DisplayName("other sources fall back to GENERIC")
    void otherSourcesAreGeneric() throws IOException {
        write("src/index.ts");
        write("package.json");
        assertEquals(Ecosystem.GENERIC, detector.detect(tempDir));
    }

    @Test
    @DisplayName("VB.NET and F# sources without a project file select DOTNET")
    void vbAndFsharpSelectDotnet() throws IOException {
        write("Legacy/Module1.vb");
        assertEquals(Ecosystem.DOTNET, detector.detect(tempDir));

        Files.delete(tempDir.resolve("Legacy/Module1.vb"));
        write("Lib/Parser.fs");
        assertEquals(Ecosystem.DOTNET, detector.detect(tempDir));
    }

    @Test
    @DisplayName("markers inside ignored directories are not counted")
    void ignoresCachedMarkers() throws IOException {
        write("node_modules/pkg/setup.py");
        write(".venv/lib/site.py");
        write(".gradle/cache/x.go");
        write("index.js");
        assertEquals(Ecosystem.GENERIC, detector.detect(tempDir));
    }

    @Test
    @DisplayName("sources under bin count toward detection")
    void binIsWalked() throws IOException {
        write("bin/tool.py");
        assertEquals(Ecosystem.PYTHON, detector.detect(tempDir));
    }

    @Test
    void containsFileMatchesAtAnyDepth() throws IOException {
        write("src/App/App.csproj");
        assertTrue(EcosystemDetector.containsFile(tempDir, f -> f.toString().endsWith(".csproj")));
        assertFalse(EcosystemDetector.containsFile(tempDir, f -> f.toString().endsWith(".sln")));
    }
}
