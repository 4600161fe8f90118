package com.vtb.nessus.cli;

import com.vtb.nessus.support.ReportFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream output;
    private Path sample;

    @BeforeEach
    void setUp() throws Exception {
        output = new ByteArrayOutputStream();
        sample = tempDir.resolve("quarterly.nessus");
        Files.write(sample, ReportFixtures.resource("sample.nessus"));
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        return new CommandLine(new MainCommand(out)).execute(args);
    }

    @Test
    void generatesAllFormats() {
        Path reports = tempDir.resolve("reports");

        int exitCode = run(sample.toString(), "-o", reports.toString(), "-n", "Q4", "-c", "ACME");

        assertEquals(MainCommand.EXIT_OK, exitCode);
        assertTrue(Files.exists(reports.resolve("quarterly.json")));
        assertTrue(Files.exists(reports.resolve("quarterly.html")));
        assertTrue(Files.exists(reports.resolve("quarterly.pdf")));
        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Находок: 6, хостов: 3"));
        assertTrue(printed.contains("Средний CVSS: 7.2"));
    }

    @Test
    void singleFormatFlag() {
        Path reports = tempDir.resolve("json-only");

        assertEquals(MainCommand.EXIT_OK, run(sample.toString(), "-o", reports.toString(), "--json-only"));

        assertTrue(Files.exists(reports.resolve("quarterly.json")));
        assertFalse(Files.exists(reports.resolve("quarterly.html")));
        assertFalse(Files.exists(reports.resolve("quarterly.pdf")));
    }

    @Test
    void failOnCriticalReturnsTwo() {
        int exitCode = run(sample.toString(), "-o", tempDir.resolve("ci").toString(),
            "--html-only", "--fail-on-critical");

        assertEquals(MainCommand.EXIT_CRITICAL_FOUND, exitCode);
    }

    @Test
    void invalidInputsReturnOne() throws Exception {
        Path wrongRoot = tempDir.resolve("nmap.nessus");
        Files.write(wrongRoot, ReportFixtures.resource("wrong-root.xml"));
        Path empty = tempDir.resolve("empty.nessus");
        Files.write(empty, ReportFixtures.resource("no-findings.nessus"));
        Path out = tempDir.resolve("out");

        assertEquals(MainCommand.EXIT_INVALID_INPUT, run());
        assertEquals(MainCommand.EXIT_INVALID_INPUT, run(tempDir.resolve("missing.nessus").toString()));
        assertEquals(MainCommand.EXIT_INVALID_INPUT, run(wrongRoot.toString(), "-o", out.toString()));
        assertEquals(MainCommand.EXIT_INVALID_INPUT, run(empty.toString(), "-o", out.toString()));
        assertFalse(Files.exists(out), "При ошибке отчеты не создаются");
    }

    @Test
    void baseNameDropsExtension() {
        assertEquals("scan", MainCommand.baseName(Path.of("/tmp/scan.nessus")));
        assertEquals("scan.v2", MainCommand.baseName(Path.of("scan.v2.nessus")));
        assertEquals("noext", MainCommand.baseName(Path.of("noext")));
        assertEquals(".hidden", MainCommand.baseName(Path.of(".hidden")));
    }
}
