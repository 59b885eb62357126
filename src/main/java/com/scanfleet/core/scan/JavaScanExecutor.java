package com.scanfleet.core.scan;

import com.scanfleet.core.config.ScanfleetProperties;
import com.scanfleet.core.model.Ecosystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Maven or Gradle pipeline. Compiled classes are required for Java analysis, so a failed
 * build or test run aborts the job before the scanner is launched.
 */
@Component
public class JavaScanExecutor implements ScanExecutor {

    private static final Logger log = LoggerFactory.getLogger(JavaScanExecutor.class);

    static final String JACOCO_PLUGIN = "org.jacoco:jacoco-maven-plugin:0.8.11";
    static final String SONAR_MAVEN_PLUGIN = "org.sonarsource.scanner.maven:sonar-maven-plugin:sonar";
    static final String GRADLE_JACOCO_REPORT = "jacocoTestReport.xml";

    private final PhaseRunner phaseRunner;
    private final ScanfleetProperties properties;

    public JavaScanExecutor(PhaseRunner phaseRunner, ScanfleetProperties properties) {
        this.phaseRunner = phaseRunner;
        this.properties = properties;
    }

    @Override
    public Ecosystem ecosystem() {
        return Ecosystem.JAVA;
    }

    @Override
    public void execute(ScanContext context) {
        Path dir = context.scanPath();
        if (Files.isRegularFile(dir.resolve("pom.xml"))) {
            executeMaven(context, dir);
        } else {
            executeGradle(context, dir);
        }
    }

    private void executeMaven(ScanContext context, Path dir) {
        log.info("Detected Maven project");
        CoverageReports.removeStale(dir, "jacoco.xml");
        phaseRunner.run(dir, Phase.fatal("maven-build", List.of(
                "mvn", "-B", "clean",
                JACOCO_PLUGIN + ":prepare-agent", "verify", JACOCO_PLUGIN + ":report")));

        var invocation = ScannerInvocation.forProject(context, properties.getSonar());
        // the Maven plugin resolves report paths per module basedir
        attachCoverage(invocation, absolute(dir, CoverageReports.find(dir, "jacoco.xml")));
        phaseRunner.run(dir, Phase.fatal("maven-sonar",
                invocation.command("mvn", "-B", SONAR_MAVEN_PLUGIN)));
    }

    private void executeGradle(ScanContext context, Path dir) {
        log.info("Detected Gradle project");
        CoverageReports.removeStale(dir, GRADLE_JACOCO_REPORT);
        phaseRunner.run(dir, Phase.fatal("gradle-build", gradleCommand(dir, "build")));

        var invocation = ScannerInvocation.forProject(context, properties.getSonar())
                .property("sonar.sources", ".")
                .property("sonar.java.binaries", "**/build/classes")
                .property("sonar.exclusions", "**/build/**");
        attachCoverage(invocation, CoverageReports.find(dir, GRADLE_JACOCO_REPORT));
        phaseRunner.run(dir, Phase.fatal("sonar-scanner",
                invocation.command(properties.getSonar().getScannerCommand())));
    }

    private void attachCoverage(ScannerInvocation invocation, List<String> reports) {
        if (reports.isEmpty()) {
            log.warn("No JaCoCo report found, scanning without coverage");
            return;
        }
        invocation.property("sonar.coverage.jacoco.xmlReportPaths", String.join(",", reports));
    }

    private static List<String> absolute(Path dir, List<String> reports) {
        return reports.stream()
                .map(r -> dir.resolve(r).toAbsolutePath().normalize().toString())
                .toList();
    }

    static List<String> gradleCommand(Path dir, String... tasks) {
        var command = new ArrayList<String>();
        Path wrapper = dir.resolve("gradlew");
        command.add(Files.isRegularFile(wrapper) ? "./gradlew" : "gradle");
        command.add("--no-daemon");
        command.addAll(List.of(tasks));
        return command;
    }
}
