package com.candlebacktest.backtester.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line runner.
 */
class BacktestCommandTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BacktestCommand command;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path candles;

    @BeforeEach
    void setUp() throws IOException {
        command = new BacktestCommand();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        candles = copyFixture("candles.csv");
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            Files.copy(in, target);
        }
        return target;
    }

    private int run(String... args) {
        return command.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testRun_PrintsResultJson() throws Exception {
        // Act
        int exit = run("--data", candles.toString(), "--strategy", "buy_and_hold", "--seed", "7");

        // Assert
        assertEquals(BacktestCommand.EXIT_OK, exit);
        JsonNode json = objectMapper.readTree(stdout());
        assertEquals("COMPLETED", json.get("status").asText());
        assertEquals("BuyAndHold", json.get("strategyName").asText());
        assertEquals(60, json.get("candlesProcessed").asInt());
        assertEquals(1, json.get("trades").size());
        assertEquals(10000.0, json.get("summary").get("initialBalance").asDouble(), 1e-9);
    }

    @Test
    void testRun_DateRangeAndOverrides() throws Exception {
        // Act
        int exit = run("--data=" + candles, "--strategy=noop", "--initial-balance", "500",
                "--start", "2024-01-10", "--end", "2024-01-19");

        // Assert
        assertEquals(BacktestCommand.EXIT_OK, exit);
        JsonNode json = objectMapper.readTree(stdout());
        assertEquals(10, json.get("candlesProcessed").asInt());
        assertEquals(500.0, json.get("summary").get("finalBalance").asDouble(), 1e-9);
        assertEquals("2024-01-10T00:00:00Z", json.get("summary").get("startDate").asText());
    }

    @Test
    void testRun_StrategyFromJsonFile() throws Exception {
        // Arrange
        Path rules = copyFixture("rules-strategy.json");

        // Act
        int exit = run("--data", candles.toString(), "--strategy", rules.toString());

        // Assert
        assertEquals(BacktestCommand.EXIT_OK, exit);
        assertEquals("ema-trend", objectMapper.readTree(stdout()).get("strategyName").asText());
    }

    @Test
    void testRun_WritesOutputFile() throws Exception {
        // Arrange
        Path output = tempDir.resolve("result.json");

        // Act
        int exit = run("--data", candles.toString(), "--strategy", "sma_rsi", "--output", output.toString());

        // Assert
        assertEquals(BacktestCommand.EXIT_OK, exit);
        assertTrue(Files.exists(output));
        assertEquals("", stdout());
        assertTrue(stderr().contains("Result written to"));
        assertEquals("COMPLETED", objectMapper.readTree(output.toFile()).get("status").asText());
    }

    @Test
    void testRun_MissingDataFile_ExitsWithFailure() {
        // Act
        int exit = run("--data", tempDir.resolve("missing.csv").toString(), "--strategy", "noop");

        // Assert
        assertEquals(BacktestCommand.EXIT_FAILURE, exit);
        assertTrue(stderr().contains("Cannot read input"));
    }

    @Test
    void testRun_EmptySeries_ExitsWithFailure() throws Exception {
        // Arrange
        Path headerOnly = tempDir.resolve("empty.csv");
        Files.writeString(headerOnly, "timestamp,open,high,low,close,volume\n", StandardCharsets.UTF_8);

        // Act
        int exit = run("--data", headerOnly.toString(), "--strategy", "noop");

        // Assert
        assertEquals(BacktestCommand.EXIT_FAILURE, exit);
        assertTrue(stderr().contains("INVALID_SERIES"));
    }

    @Test
    void testRun_UnknownStrategy_ExitsWithUsage() {
        // Act
        int exit = run("--data", candles.toString(), "--strategy", "martingale");

        // Assert
        assertEquals(BacktestCommand.EXIT_USAGE, exit);
        assertTrue(stderr().contains("martingale"));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void testRun_InvalidOptions_ExitWithUsage() {
        assertEquals(BacktestCommand.EXIT_USAGE, run("--strategy", "noop"));
        assertEquals(BacktestCommand.EXIT_USAGE, run("--data", candles.toString(), "--strategy", "noop", "--verbose"));
        assertEquals(BacktestCommand.EXIT_USAGE,
                run("--data", candles.toString(), "--strategy", "noop", "--commission-rate", "abc"));
        assertEquals(BacktestCommand.EXIT_USAGE,
                run("--data", candles.toString(), "--strategy", "noop", "--commission-rate", "1.5"));
        assertEquals(BacktestCommand.EXIT_USAGE,
                run("--data", candles.toString(), "--strategy", "noop", "--start", "01/10/2024"));
        assertEquals("", stdout());
    }

    @Test
    void testHelp_PrintsUsage() {
        // Act
        int exit = run("--help");

        // Assert
        assertEquals(BacktestCommand.EXIT_OK, exit);
        assertTrue(stdout().startsWith("Usage: backtest"));
    }

    @Test
    void testParse_InlineAndSeparateValues() throws Exception {
        // Act
        Map<String, String> options = command.parse(new String[]{
                "--data=a.csv", "--strategy", "noop", "--strict", "--seed=3"});

        // Assert
        assertEquals("a.csv", options.get("data"));
        assertEquals("noop", options.get("strategy"));
        assertEquals("true", options.get("strict"));
        assertEquals("3", options.get("seed"));
    }

    @Test
    void testParse_MissingValue() {
        BacktestCommand.UsageException e = assertThrows(BacktestCommand.UsageException.class,
                () -> command.parse(new String[]{"--data", "--strategy", "noop"}));
        assertEquals("Missing value for --data", e.getMessage());
    }
}
