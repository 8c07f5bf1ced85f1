package com.herzen.migration.report;

import java.util.List;
import java.util.Map;

public class ReportModels {
    public enum Stage { MANIFEST, INVENTORY, EXTRACTION, TRANSFORM, LINKS, INTEGRITY, EXPORT }

    public enum Severity { INFO, WARNING, ERROR }

    public enum TerminalStatus { SUCCESS, SUCCESS_WITH_WARNINGS, FAILED }

    public record ReportEvent(int sequence, Stage stage, Severity severity, String code, String message, String entityId) {}

    public record MigrationReport(TerminalStatus status, List<ReportEvent> events, Map<String, Integer> counters) {
        public long count(Severity severity) {
            return events.stream().filter(e -> e.severity() == severity).count();
        }

        public List<ReportEvent> eventsWithCode(String code) {
            return events.stream().filter(e -> e.code().equals(code)).toList();
        }

        public int counter(String name) {
            return counters.getOrDefault(name, 0);
        }
    }
}
