package com.herzen.migration.report;

import com.herzen.migration.report.ReportModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Append-only and single-writer; every write after {@link #freeze()} throws. */
public class ReportAggregator {
    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);
    private static final Set<Stage> FATAL_STAGES = EnumSet.of(Stage.MANIFEST, Stage.INTEGRITY);

    private final List<ReportEvent> events = new ArrayList<>();
    private final Map<String, Integer> counters = new TreeMap<>();
    private MigrationReport frozen;

    public void append(Stage stage, Severity severity, String code, String message, String entityId) {
        ensureOpen();
        ReportEvent event = new ReportEvent(events.size() + 1, stage, severity, code, message, entityId);
        events.add(event);
        switch (severity) {
            case INFO -> log.info("[{}] {} {} ({})", stage, code, message, entityId);
            case WARNING -> log.warn("[{}] {} {} ({})", stage, code, message, entityId);
            case ERROR -> log.error("[{}] {} {} ({})", stage, code, message, entityId);
        }
    }

    public void info(Stage stage, String code, String message, String entityId) {
        append(stage, Severity.INFO, code, message, entityId);
    }

    public void warning(Stage stage, String code, String message, String entityId) {
        append(stage, Severity.WARNING, code, message, entityId);
    }

    public void error(Stage stage, String code, String message, String entityId) {
        append(stage, Severity.ERROR, code, message, entityId);
    }

    public void increment(String counter) {
        add(counter, 1);
    }

    public void add(String counter, int amount) {
        ensureOpen();
        counters.merge(counter, amount, Integer::sum);
    }

    public int counter(String counter) {
        return counters.getOrDefault(counter, 0);
    }

    public boolean hasErrors(Stage stage) {
        return events.stream().anyMatch(e -> e.stage() == stage && e.severity() == Severity.ERROR);
    }

    public Set<String> errorEntityIds() {
        Set<String> ids = new LinkedHashSet<>();
        events.stream()
                .filter(e -> e.severity() == Severity.ERROR && e.entityId() != null)
                .forEach(e -> ids.add(e.entityId()));
        return ids;
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    public MigrationReport freeze() {
        if (frozen == null) {
            frozen = new MigrationReport(status(), List.copyOf(events), Collections.unmodifiableMap(new TreeMap<>(counters)));
            log.info("Migration report frozen: status={}, events={}", frozen.status(), frozen.events().size());
        }
        return frozen;
    }

    TerminalStatus status() {
        boolean fatal = events.stream().anyMatch(e -> e.severity() == Severity.ERROR && FATAL_STAGES.contains(e.stage()));
        if (fatal) return TerminalStatus.FAILED;
        boolean degraded = events.stream().anyMatch(e -> e.severity() != Severity.INFO);
        return degraded ? TerminalStatus.SUCCESS_WITH_WARNINGS : TerminalStatus.SUCCESS;
    }

    private void ensureOpen() {
        if (frozen != null) throw new IllegalStateException("Migration report is frozen");
    }
}
