package com.herzen.migration.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.migration.report.ReportModels.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class MigrationRunJdbcRepository {
    private static final int MAX_MESSAGE = 2048;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public MigrationRunJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void save(String runId, String rootPath, String courseId, MigrationReport report) {
        jdbcTemplate.update("DELETE FROM migration_events WHERE run_id = ?", runId);
        jdbcTemplate.update("DELETE FROM migration_runs WHERE run_id = ?", runId);

        jdbcTemplate.update(
                "INSERT INTO migration_runs(run_id, root_path, course_id, status, counters_json, created_at) VALUES (?,?,?,?,?,?)",
                runId, rootPath, courseId, report.status().name(), toJson(report.counters()), Timestamp.from(Instant.now()));

        report.events().forEach(e -> jdbcTemplate.update(
                "INSERT INTO migration_events(run_id, seq, stage, severity, code, message, entity_id) VALUES (?,?,?,?,?,?,?)",
                runId, e.sequence(), e.stage().name(), e.severity().name(), e.code(), truncate(e.message()), e.entityId()));
    }

    public Optional<RunRow> findRun(String runId) {
        return jdbcTemplate.query(
                "SELECT run_id, root_path, course_id, status, counters_json, created_at FROM migration_runs WHERE run_id = ?",
                (rs, rowNum) -> new RunRow(rs.getString(1), rs.getString(2), rs.getString(3),
                        TerminalStatus.valueOf(rs.getString(4)), fromJson(rs.getString(5)), rs.getTimestamp(6).toInstant()),
                runId).stream().findFirst();
    }

    public List<ReportEvent> loadEvents(String runId) {
        return jdbcTemplate.query(
                "SELECT seq, stage, severity, code, message, entity_id FROM migration_events WHERE run_id = ? ORDER BY seq",
                (rs, rowNum) -> new ReportEvent(rs.getInt(1), Stage.valueOf(rs.getString(2)), Severity.valueOf(rs.getString(3)),
                        rs.getString(4), rs.getString(5), rs.getString(6)),
                runId);
    }

    private String toJson(Map<String, Integer> counters) {
        try {
            return objectMapper.writeValueAsString(counters);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise run counters", e);
        }
    }

    private Map<String, Integer> fromJson(String json) {
        if (json == null) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Integer>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored run counters are not valid JSON", e);
        }
    }

    private static String truncate(String message) {
        return message.length() <= MAX_MESSAGE ? message : message.substring(0, MAX_MESSAGE);
    }

    public record RunRow(String runId, String rootPath, String courseId, TerminalStatus status,
                         Map<String, Integer> counters, Instant createdAt) {}
}
