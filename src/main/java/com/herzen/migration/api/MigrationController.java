package com.herzen.migration.api;

import com.herzen.migration.report.ReportModels.MigrationReport;
import com.herzen.migration.service.MigrationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api/migrations")
public class MigrationController {
    private final MigrationService migrationService;

    public MigrationController(MigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @PostMapping
    public ResponseEntity<RunResponse> migrate(@RequestBody MigrationRequest request) {
        if (request == null || request.rootPath() == null || request.rootPath().isBlank()) {
            throw new IllegalArgumentException("rootPath is required");
        }
        Path root = Path.of(request.rootPath());
        Path output = request.outputPath() == null || request.outputPath().isBlank() ? null : Path.of(request.outputPath());
        MigrationService.MigrationOutcome outcome = request.export()
                ? migrationService.runAndExport(root, output)
                : migrationService.run(root);
        return ResponseEntity.ok(new RunResponse(outcome.runId(),
                outcome.graph() == null ? null : outcome.graph().course().id(), outcome.report()));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<MigrationService.StoredRun> run(@PathVariable String runId) {
        return migrationService.findRun(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    public record MigrationRequest(String rootPath, String outputPath, boolean export) {}

    public record RunResponse(String runId, String courseId, MigrationReport report) {}
}
