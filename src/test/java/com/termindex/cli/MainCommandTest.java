package com.termindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.termindex.config.IndexConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--charset", "ISO-8859-1", "search", "home", "--doc", "a.txt");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testSearchRequiresCorpusSource() {
        int exitCode = new CommandLine(new MainCommand()).execute("search", "home");
        assertEquals(2, exitCode);
    }

    @Test
    void testSearchTextDocuments() throws Exception {
        Path first = Files.writeString(tempDir.resolve("doc0.txt"), "new home sales top forecasts");
        Path second = Files.writeString(tempDir.resolve("doc1.txt"), "home sales rise in July");

        String output = runCapturingOutput(0, "search", "Home", "missing",
            "--doc", first.toString(), second.toString());

        assertTrue(output.contains("Found: Home in documents: [0, 1]"));
        assertTrue(output.contains("Not Found: missing"));
    }

    @Test
    void testSearchTokenizedJson() throws Exception {
        Path corpus = Files.writeString(tempDir.resolve("corpus.json"),
            "{\"1\": [\"1001\", \"1002\"], \"23\": [\"1001\", \"1003\"]}");

        String output = runCapturingOutput(0, "search", "1001", "--tokenized", corpus.toString(), "--format", "json");

        assertTrue(output.contains("\"searchTerm\""));
        assertTrue(output.contains("\"documentFrequency\" : 2"));
    }

    @Test
    void testPostingsTextOutput() throws Exception {
        Path corpus = Files.writeString(tempDir.resolve("corpus.json"),
            "{\"1\": [\"1001\", \"1002\"], \"23\": [\"1001\", \"1003\"]}");

        String output = runCapturingOutput(0, "postings", "--tokenized", corpus.toString());

        assertTrue(output.indexOf("1001") < output.indexOf("1002"));
        assertTrue(output.indexOf("1002") < output.indexOf("1003"));
        assertTrue(output.contains("[1, 23]"));
        assertTrue(output.contains("词条数: 3"));
    }

    @Test
    void testPostingsJsonOutput() throws Exception {
        Path document = Files.writeString(tempDir.resolve("doc.txt"), "alpha beta alpha");

        String output = runCapturingOutput(0, "postings", "--doc", document.toString(), "-f", "json");

        assertTrue(output.contains("\"term\" : \"alpha\""));
        assertTrue(output.contains("\"documentIds\""));
    }

    @Test
    void testSearchMissingFileReturnsOne() {
        int exitCode = new CommandLine(new MainCommand())
            .execute("search", "home", "--doc", tempDir.resolve("missing.txt").toString());
        assertEquals(1, exitCode);
    }

    @Test
    void testSearchRejectsOverlongQuery() throws Exception {
        Path document = Files.writeString(tempDir.resolve("doc.txt"), "home");

        int exitCode = new CommandLine(new MainCommand())
            .execute("search", "x".repeat(300), "--doc", document.toString());
        assertEquals(2, exitCode);
    }

    @Test
    void testSanitizeQueryTermsThrowsParameterException() {
        MainCommand command = new MainCommand();
        IndexConfig config = IndexConfig.defaults();
        config.setMaxQueryTerms(1);

        assertThrows(CommandLine.ParameterException.class,
            () -> command.sanitizeQueryTerms(List.of("a", "b"), config));
        assertEquals(List.of("a"), command.sanitizeQueryTerms(List.of("a"), config));
    }

    @Test
    void testTokensSubcommand() throws Exception {
        String output = runCapturingOutput(0, "tokens", "Home sales HOME");
        assertTrue(output.contains("[home, sales]"));

        String rawOutput = runCapturingOutput(0, "tokens", "--raw", "Home sales HOME");
        assertTrue(rawOutput.contains("2\thome\tHOME\t[11,15)"));
    }

    @Test
    void testTokensSubcommandDirectCall() throws Exception {
        Callable<Integer> tokens = new MainCommand.TokensSubcommand();
        CommandLine.populateCommand(tokens, "a b");
        assertEquals(0, captureOutput(tokens).exitCode());
    }

    private String runCapturingOutput(int expectedExitCode, String... args) throws Exception {
        Captured captured = captureOutput(() -> new CommandLine(new MainCommand()).execute(args));
        assertEquals(expectedExitCode, captured.exitCode());
        return captured.output();
    }

    private Captured captureOutput(Callable<Integer> action) throws Exception {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int exitCode;
        try {
            System.setOut(new PrintStream(outputBuffer, true, "UTF-8"));
            exitCode = action.call();
        } finally {
            System.setOut(originalOut);
        }
        return new Captured(exitCode, outputBuffer.toString("UTF-8"));
    }

    private record Captured(int exitCode, String output) {
    }
}
