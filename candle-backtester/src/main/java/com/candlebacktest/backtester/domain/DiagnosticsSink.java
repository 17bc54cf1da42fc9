package com.candlebacktest.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one run.
 */
@Slf4j
public class DiagnosticsSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void record(Diagnostic.Type type, int candleIndex, long timestamp, String message) {
        Diagnostic diagnostic = new Diagnostic(type, candleIndex, timestamp, message);
        diagnostics.add(diagnostic);
        log.warn("{} at candle {} ({}): {}", type, candleIndex, timestamp, message);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public long count(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.getType() == type).count();
    }

    public int size() {
        return diagnostics.size();
    }
}
