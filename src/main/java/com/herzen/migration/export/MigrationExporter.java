package com.herzen.migration.export;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.herzen.migration.report.ReportModels.MigrationReport;
import com.herzen.migration.transform.TargetModels.TargetCourseGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class MigrationExporter {
    public static final String GRAPH_FILE = "course_graph.json";
    public static final String REPORT_FILE = "migration_report.json";

    private static final Logger log = LoggerFactory.getLogger(MigrationExporter.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public String graphJson(TargetCourseGraph graph) {
        return write(graph);
    }

    public String reportJson(MigrationReport report) {
        return write(report);
    }

    public Path writeGraph(TargetCourseGraph graph, Path outputDir) {
        return writeFile(outputDir, GRAPH_FILE, graphJson(graph));
    }

    public Path writeReport(MigrationReport report, Path outputDir) {
        return writeFile(outputDir, REPORT_FILE, reportJson(report));
    }

    private Path writeFile(Path outputDir, String fileName, String json) {
        Path target = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, json + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
        log.info("Wrote {}", target);
        return target;
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
