package com.herzen.migration.service;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.export.MigrationExporter;
import com.herzen.migration.inventory.ContentReader;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import com.herzen.migration.inventory.InventoryModels.ReconciliationResult;
import com.herzen.migration.inventory.InventoryReconciler;
import com.herzen.migration.inventory.InventoryScanner;
import com.herzen.migration.link.LinkAssetResolver;
import com.herzen.migration.manifest.ManifestModels.ResolvedManifest;
import com.herzen.migration.manifest.ManifestResolutionException;
import com.herzen.migration.manifest.ManifestResolver;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.MigrationReport;
import com.herzen.migration.report.ReportModels.ReportEvent;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.repository.MigrationRunJdbcRepository;
import com.herzen.migration.source.SourceEntityLoader;
import com.herzen.migration.source.SourceModels.LoadedSources;
import com.herzen.migration.transform.EntityTransformer;
import com.herzen.migration.transform.TargetModels.TargetCourseGraph;
import com.herzen.migration.validation.IntegrityVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class MigrationService {
    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final MigrationProperties properties;
    private final ManifestResolver manifestResolver;
    private final InventoryScanner inventoryScanner;
    private final InventoryReconciler reconciler;
    private final SourceEntityLoader loader;
    private final EntityTransformer transformer;
    private final LinkAssetResolver linkResolver;
    private final IntegrityVerifier verifier;
    private final MigrationExporter exporter;
    private final MigrationRunJdbcRepository runs;

    public MigrationService(MigrationProperties properties,
                            ManifestResolver manifestResolver,
                            InventoryScanner inventoryScanner,
                            InventoryReconciler reconciler,
                            SourceEntityLoader loader,
                            EntityTransformer transformer,
                            LinkAssetResolver linkResolver,
                            IntegrityVerifier verifier,
                            MigrationExporter exporter,
                            MigrationRunJdbcRepository runs) {
        this.properties = properties;
        this.manifestResolver = manifestResolver;
        this.inventoryScanner = inventoryScanner;
        this.reconciler = reconciler;
        this.loader = loader;
        this.transformer = transformer;
        this.linkResolver = linkResolver;
        this.verifier = verifier;
        this.exporter = exporter;
        this.runs = runs;
    }

    public MigrationOutcome run(Path courseRoot) {
        return execute(courseRoot, null);
    }

    public MigrationOutcome runAndExport(Path courseRoot, Path outputDir) {
        return execute(courseRoot, outputDir == null ? courseRoot.resolve(properties.outputDirectory()) : outputDir);
    }

    public Optional<StoredRun> findRun(String runId) {
        return runs.findRun(runId).map(run -> new StoredRun(run, runs.loadEvents(runId)));
    }

    private MigrationOutcome execute(Path courseRoot, Path outputDir) {
        if (courseRoot == null || !Files.isDirectory(courseRoot)) {
            throw new IllegalArgumentException("Course root is not a directory: " + courseRoot);
        }
        String runId = UUID.randomUUID().toString();
        log.info("Migration {} started for {}", runId, courseRoot);

        ReportAggregator report = new ReportAggregator();
        TargetCourseGraph graph = null;
        try {
            ResolvedManifest manifest = manifestResolver.resolve(courseRoot, report);
            Inventory inventory = inventoryScanner.scan(courseRoot, outputDir);
            ContentReader reader = ContentReader.forRoot(courseRoot);

            ReconciliationResult reconciliation = reconciler.reconcile(manifest, inventory, reader, report);
            LoadedSources sources = loader.load(manifest, reconciliation.mergedTree(), inventory, reader, report);
            graph = transformer.transform(manifest, reconciliation, sources, report);
            graph = linkResolver.resolve(graph, inventory, report);
            verifier.verify(graph, manifest, reconciliation, sources, report);
        } catch (ManifestResolutionException e) {
            report.error(Stage.MANIFEST, e.code(), e.getMessage(), null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan course files under " + courseRoot, e);
        }

        if (outputDir != null && graph != null) {
            try {
                exporter.writeGraph(graph, outputDir);
                report.info(Stage.EXPORT, "GRAPH_EXPORTED", "Course graph written to " + MigrationExporter.GRAPH_FILE, graph.course().id());
            } catch (UncheckedIOException e) {
                report.error(Stage.EXPORT, "EXPORT_FAILED", e.getMessage(), graph.course().id());
            }
        }

        MigrationReport frozen = report.freeze();
        if (outputDir != null) exporter.writeReport(frozen, outputDir);
        if (properties.persistRuns()) {
            runs.save(runId, courseRoot.toString(), graph == null ? null : graph.course().sourceId(), frozen);
        }
        log.info("Migration {} finished with status {}", runId, frozen.status());
        return new MigrationOutcome(runId, graph, frozen);
    }

    public record MigrationOutcome(String runId, TargetCourseGraph graph, MigrationReport report) {}

    public record StoredRun(MigrationRunJdbcRepository.RunRow run, List<ReportEvent> events) {}
}
