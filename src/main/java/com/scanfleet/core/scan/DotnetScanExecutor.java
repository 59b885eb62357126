package com.scanfleet.core.scan;

import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.model.Ecosystem;
import com.scanfleet.core.scanner.EcosystemDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * .NET pipeline wrapped in the scanner's begin/end steps. Restore, build and test are each
 * tolerated so that a partial build still produces an analysis; failure of begin or end
 * (or anything unexpected) downgrades the job to a sources-only scan.
 * <p>
 * Repositories with C# sources but no project file get a throwaway project for the
 * duration of the pipeline.
 */
@Component
public class DotnetScanExecutor implements ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(DotnetScanExecutor.class);

    static final String GENERATED_PROJECT = "ScanfleetGenerated.csproj";

    static final String GENERATED_PROJECT_CONTENT = """
            <Project Sdk="Microsoft.NET.Sdk">
              <PropertyGroup>
                <TargetFramework>net8.0</TargetFramework>
                <OutputType>Library</OutputType>
                <Nullable>enable</Nullable>
                <ImplicitUsings>enable</ImplicitUsings>
              </PropertyGroup>
            </Project>
            """;

    private final PhaseRunner phaseRunner;
    private final ScanfleetProperties properties;

    public DotnetScanExecutor(PhaseRunner phaseRunner, ScanfleetProperties properties) {
        this.phaseRunner = phaseRunner;
        this.properties = properties;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.DOTNET;
    }

    @Override
    public boolean fallsBackToGeneric() {
        return true;
    }

    @Override
    public void execute(ScanContext context) {
        Path dir = context.scanPath();
        Path generated = hasProjectFile(dir) ? null : generateProject(dir);
        try {
            var invocation = ScannerInvocation.forProject(context, properties.getSonar())
                    .property("sonar.cs.opencover.reportsPaths", "**/coverage.opencover.xml")
                    .property("sonar.cs.vstest.reportsPaths", "**/*.trx");

            phaseRunner.run(dir, Phase.fallbackOnFailure("dotnet-begin", invocation.dotnetBegin()));
            phaseRunner.run(dir, Phase.tolerated("dotnet-restore", List.of("dotnet", "restore")));
            phaseRunner.run(dir, Phase.tolerated("dotnet-build", List.of("dotnet", "build", "--no-restore")));
            phaseRunner.run(dir, Phase.tolerated("dotnet-test", List.of(
                    "dotnet", "test", "--no-build",
                    "--collect:XPlat Code Coverage;Format=opencover",
                    "--logger", "trx")));
            phaseRunner.run(dir, Phase.fallbackOnFailure("dotnet-end", invocation.dotnetEnd()));
        } finally {
            if (generated != null) {
                deleteGenerated(generated);
            }
        }
    }

    static boolean hasProjectFile(Path dir) {
        return EcosystemDetector.containsFile(dir, f -> {
            String name = f.getFileName().toString();
            return name.endsWith(".sln") || name.endsWith(".csproj")
                    || name.endsWith(".vbproj") || name.endsWith(".fsproj");
        });
    }

    private Path generateProject(Path dir) {
        Path project = dir.resolve(GENERATED_PROJECT);
        log.info("No .NET project file found, generating {}", project);
        try {
            return Files.writeString(project, GENERATED_PROJECT_CONTENT);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not generate " + project, e);
        }
    }

    private void deleteGenerated(Path generated) {
        try {
            Files.deleteIfExists(generated);
        } catch (IOException e) {
            log.warn("Could not delete generated project {}: {}", generated, e.getMessage());
        }
    }
}
