package com.candlebacktest.backtester.cli;

import com.candlebacktest.backtester.controller.dto.BacktestResponse;
import com.candlebacktest.backtester.domain.BacktestConfig;
import com.candlebacktest.backtester.domain.BacktestEngine;
import com.candlebacktest.backtester.domain.BacktestResult;
import com.candlebacktest.backtester.domain.CandleSeries;
import com.candlebacktest.backtester.domain.strategy.Strategy;
import com.candlebacktest.backtester.exception.BacktestException;
import com.candlebacktest.backtester.service.CsvCandleImporter;
import com.candlebacktest.backtester.service.StrategyDefinition;
import com.candlebacktest.backtester.service.StrategyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parses command-line options and runs one backtest.
 *
 * <p>Exit codes: 0 on success, 1 when the run fails or the input cannot be read,
 * 2 on usage errors.
 */
@Slf4j
public class BacktestCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final Set<String> VALUE_OPTIONS = Set.of("data", "strategy", "initial-balance",
            "commission-rate", "slippage-rate", "min-lot-size", "seed", "start", "end", "output");
    private static final Set<String> FLAG_OPTIONS = Set.of("strict", "random-slippage", "help");

    private static final String USAGE = "Usage: backtest --data <csv> --strategy <name|json-file>"
            + " [--initial-balance N] [--commission-rate R] [--slippage-rate R] [--random-slippage]"
            + " [--min-lot-size N] [--strict] [--seed N] [--start yyyy-MM-dd] [--end yyyy-MM-dd]"
            + " [--output path]";

    private final ObjectMapper objectMapper;
    private final StrategyFactory strategyFactory;
    private final CsvCandleImporter importer;
    private final BacktestEngine engine;

    public BacktestCommand() {
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.strategyFactory = new StrategyFactory(objectMapper);
        this.importer = new CsvCandleImporter();
        this.engine = new BacktestEngine();
    }

    /**
     * Thrown for malformed or missing options.
     */
    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options;
        try {
            options = parse(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.containsKey("help")) {
            out.println(USAGE);
            return EXIT_OK;
        }

        try {
            StrategyDefinition definition = loadStrategy(options.get("strategy"));
            Strategy strategy = strategyFactory.createStrategy(definition);
            BacktestConfig config = toConfig(options, definition);

            CsvCandleImporter.ImportResult imported = importer.importFile(Path.of(options.get("data")));
            if (!imported.getErrors().isEmpty()) {
                err.printf("Skipped %d malformed rows%n", imported.getErrors().size());
            }
            CandleSeries series = CandleSeries.of(imported.getCandles())
                    .between(startOfDay(options.get("start")), endOfDay(options.get("end")));

            BacktestResult result = engine.run(series, strategy, config);
            String json = objectMapper.writeValueAsString(BacktestResponse.from(result));

            if (options.containsKey("output")) {
                Files.writeString(Path.of(options.get("output")), json, StandardCharsets.UTF_8);
                err.println("Result written to " + options.get("output"));
            } else {
                out.println(json);
            }
            return EXIT_OK;
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (BacktestException e) {
            log.error("Backtest failed: {}", e.getMessage());
            err.println("Backtest failed [" + e.getErrorCode() + "]: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Cannot read input: {}", e.getMessage());
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
    }

    Map<String, String> parse(String[] args) throws UsageException {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            if (FLAG_OPTIONS.contains(name)) {
                options.put(name, value != null ? value : "true");
            } else if (VALUE_OPTIONS.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
                        throw new UsageException("Missing value for --" + name);
                    }
                    value = args[++i];
                }
                options.put(name, value);
            } else {
                throw new UsageException("Unknown option: --" + name);
            }
        }

        if (!options.containsKey("help")) {
            if (!options.containsKey("data")) {
                throw new UsageException("--data is required");
            }
            if (!options.containsKey("strategy")) {
                throw new UsageException("--strategy is required");
            }
        }
        return options;
    }

    private StrategyDefinition loadStrategy(String strategy) throws IOException {
        Path path = Path.of(strategy);
        if (strategy.endsWith(".json") || Files.isRegularFile(path)) {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            try {
                return strategyFactory.parseDefinition(json);
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid strategy file " + strategy + ": " + e.getMessage(), e);
            }
        }
        return new StrategyDefinition(strategy, new HashMap<>());
    }

    private static BacktestConfig toConfig(Map<String, String> options, StrategyDefinition definition)
            throws UsageException {
        BacktestConfig.BacktestConfigBuilder config = BacktestConfig.builder();
        if (options.containsKey("initial-balance")) {
            config.initialBalance(number(options, "initial-balance"));
        }
        if (options.containsKey("commission-rate")) {
            config.commissionRate(number(options, "commission-rate"));
        }
        if (options.containsKey("slippage-rate")) {
            config.slippageRate(number(options, "slippage-rate"));
        }
        if (options.containsKey("min-lot-size")) {
            config.minLotSize(number(options, "min-lot-size"));
        }
        if (options.containsKey("seed")) {
            try {
                config.seed(Long.parseLong(options.get("seed")));
            } catch (NumberFormatException e) {
                throw new UsageException("--seed must be an integer, got " + options.get("seed"));
            }
        }
        config.strictMode(Boolean.parseBoolean(options.getOrDefault("strict", "false")));
        config.randomSlippage(Boolean.parseBoolean(options.getOrDefault("random-slippage", "false")));
        if (definition.getParameters() != null) {
            config.strategyParameters(definition.getParameters());
        }

        BacktestConfig built = config.build();
        try {
            built.validate();
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        return built;
    }

    private static double number(Map<String, String> options, String name) throws UsageException {
        try {
            return Double.parseDouble(options.get(name));
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be a number, got " + options.get(name));
        }
    }

    private static Long startOfDay(String date) throws UsageException {
        return date == null ? null : date(date).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    private static Long endOfDay(String date) throws UsageException {
        return date == null ? null : date(date).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli() - 1;
    }

    private static LocalDate date(String value) throws UsageException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new UsageException("Dates must be yyyy-MM-dd, got " + value);
        }
    }
}
