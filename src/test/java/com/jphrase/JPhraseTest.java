package com.jphrase;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class JPhraseTest extends PhraseLoggingConfig {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new JPhrase());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    public void testCompactOutput() {
        int exitCode = run("-c", "-p", "perform_task", "perform 5 10 task");

        assertEquals(0, exitCode);
        assertEquals("(APPLY_TO (LIST 5 10) perform_task)", out.toString().trim());
        assertEquals("", err.toString());
    }

    @Test
    public void testPrettyOutputIsDefault() {
        int exitCode = run("--phrase", "perform_task", "perform 5 task");

        assertEquals(0, exitCode);
        assertEquals("APPLY_TO\n  NUMBER 5\n  IDENTIFIER perform_task", out.toString().trim().replace("\r\n", "\n"));
    }

    @Test
    public void testRepeatedPhraseOption() {
        int exitCode = run("-c", "-p", "perform_task", "-p", "special", "perform special task");

        assertEquals(0, exitCode);
        assertEquals("(APPLY_TO (EMPTY_APPLY special _) perform_task)", out.toString().trim());
    }

    @Test
    public void testPhraseFile() throws URISyntaxException {
        String file = Paths.get(getClass().getResource("/phrases.json").toURI()).toString();

        int exitCode = run("-c", "-f", file, "perform 5 super special task");

        assertEquals(0, exitCode);
        assertEquals("(APPLY_TO (LIST 5 (EMPTY_APPLY super_special _)) perform_task)", out.toString().trim());
    }

    @Test
    public void testNoPhrases() {
        int exitCode = run("-c", "perform task");

        assertEquals(0, exitCode);
        assertEquals("(LIST perform task)", out.toString().trim());
    }

    @Test
    public void testSyntaxError() {
        int exitCode = run("-p", "perform_task", "perform (task");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: Unclosed '('"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void testConflictingPhrases() {
        int exitCode = run("-p", "task", "-p", "task_force", "task");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Cannot add phrase 'task_force'"), err.toString());
    }

    @Test
    public void testMissingPhraseFile() {
        int exitCode = run("-f", "does-not-exist.json", "task");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testVerbose() {
        int exitCode = run("-v", "-c", "-p", "task", "task");

        assertEquals(0, exitCode);
        assertEquals("(EMPTY_APPLY task _)", out.toString().trim());
    }
}
