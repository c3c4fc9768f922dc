package work.lcod.scriptgen.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.scriptgen.api.LogLevel;

class GenerateCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void printsScriptToStdout(@TempDir Path dir) throws Exception {
        var graph = dir.resolve("graph.yaml");
        Files.writeString(graph, "blocks:\n  - { id: a, title: Get-Date, command: Get-Date }\n");

        assertEquals(0, run("--graph", graph.toString(), "--no-header", "--log-level", "error"));
        assertEquals("# ── Execution ───────────────────────────────\n\nGet-Date\n\n", out.toString());
    }

    @Test
    void settingsFileBesideGraphIsPickedUpAndFlagsOverrideIt(@TempDir Path dir) throws Exception {
        var graph = dir.resolve("graph.yaml");
        Files.writeString(graph, """
            blocks:
              - { id: loop, container: ForEach, zones: [ { name: Body, children: [ w ] } ] }
              - { id: w, command: Write-Output }
            """);
        Files.writeString(dir.resolve("scriptgen.toml"), "indent = 2\nheaderTitle = \"From file\"\n");

        assertEquals(0, run("-g", graph.toString(), "--log-level", "error"));
        assertTrue(out.toString().contains("# From file\n"), out.toString());
        assertTrue(out.toString().contains("\n  $_ | Write-Output\n"), out.toString());

        out.getBuffer().setLength(0);
        assertEquals(0, run("-g", graph.toString(), "--indent", "3", "--no-header", "--log-level", "error"));
        assertFalse(out.toString().contains("# From file"));
        assertTrue(out.toString().contains("\n   $_ | Write-Output\n"), out.toString());
    }

    @Test
    void writesToOutputFileAndReports(@TempDir Path dir) throws Exception {
        var graph = dir.resolve("graph.yaml");
        Files.writeString(graph, "blocks:\n  - { id: a, command: Get-Date }\n");
        var target = dir.resolve("script.ps1");

        assertEquals(0, run("-g", graph.toString(), "-o", target.toString(), "--report", "--log-level", "error"));
        assertEquals("", out.toString());
        assertTrue(Files.readString(target).contains("Get-Date\n"));
        assertTrue(err.toString().contains("\"status\" : \"success\""), err.toString());
    }

    @Test
    void cycleExitsWithTwo(@TempDir Path dir) throws Exception {
        var graph = dir.resolve("graph.yaml");
        Files.writeString(graph, """
            blocks:
              - { id: a, command: Get-Date }
              - { id: b, command: Out-String }
            connections:
              - { source: a, target: b }
              - { source: b, target: a }
            """);

        assertEquals(2, run("-g", graph.toString(), "--log-level", "fatal"));
        assertEquals("# ERROR: Cycle detected in graph!\n", out.toString());
    }

    @Test
    void unreadableGraphExitsWithOne(@TempDir Path dir) {
        assertEquals(1, run("-g", dir.resolve("missing.yaml").toString(), "--log-level", "error"));
        assertTrue(err.toString().contains("missing.yaml"), err.toString());
    }

    @Test
    void missingGraphOptionIsAUsageError() {
        assertEquals(2, run());
        assertTrue(err.toString().contains("--graph"), err.toString());
    }

    @Test
    void fatalMapsToLogbackError() {
        assertEquals(Level.ERROR, LoggingConfigurator.toLogback(LogLevel.FATAL));
        assertEquals(Level.DEBUG, LoggingConfigurator.toLogback(LogLevel.from("debug")));
    }
}
