package com.herzen.migration.inventory;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.ContentKind;
import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import com.herzen.migration.extract.MarkupExtractor;
import com.herzen.migration.extract.MarkupFormat;
import com.herzen.migration.extract.MarkupParseException;
import com.herzen.migration.extract.SlideDeckExtractor;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import com.herzen.migration.inventory.InventoryModels.ReconciliationResult;
import com.herzen.migration.manifest.ManifestModels.OrganizationNode;
import com.herzen.migration.manifest.ManifestModels.ResolvedManifest;
import com.herzen.migration.manifest.ManifestModels.ResourceDescriptor;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.source.SourceModels.RecoveredContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.*;

@Component
public class InventoryReconciler {
    public static final String RECOVERED_MODULE_ID = "recovered_content_module";

    private static final Logger log = LoggerFactory.getLogger(InventoryReconciler.class);

    private final MigrationProperties properties;
    private final MarkupExtractor extractor;
    private final SlideDeckExtractor slideDecks;

    public InventoryReconciler(MigrationProperties properties, MarkupExtractor extractor, SlideDeckExtractor slideDecks) {
        this.properties = properties;
        this.extractor = extractor;
        this.slideDecks = slideDecks;
    }

    public static SortedSet<String> unreferenced(Set<String> inventory, Set<String> referenced) {
        SortedSet<String> difference = new TreeSet<>(inventory);
        difference.removeAll(referenced);
        return Collections.unmodifiableSortedSet(difference);
    }

    public ReconciliationResult reconcile(ResolvedManifest manifest, Inventory inventory,
                                          ContentReader reader, ReportAggregator report) {
        SortedSet<String> unreferenced = unreferenced(inventory.files(), manifest.referencedPaths());
        report.add("inventoryFiles", inventory.files().size());

        SortedSet<String> recognized = new TreeSet<>();
        SortedSet<String> failed = new TreeSet<>();
        Map<String, RecoveredContent> recovered = new LinkedHashMap<>();
        SortedMap<String, OrganizationNode> placements = new TreeMap<>();

        for (String path : unreferenced) {
            if (properties.isSystemFile(MigrationProperties.fileName(path))) {
                log.debug("Skipping system file {}", path);
                continue;
            }
            report.increment("unreferencedFiles");
            if (!properties.isRecognizedContent(path)) {
                report.info(Stage.INVENTORY, "UNREFERENCED_FILE", "File not referenced by the manifest and not recognized as content: " + path, path);
                continue;
            }
            recognized.add(path);
            String id = CoursePaths.recoveredId(path);
            try {
                ExtractedFields fields = properties.isPresentation(path)
                        ? slideDecks.extract(reader.readBytes(path))
                        : extractor.extract(reader.read(path), MarkupFormat.of(path, properties), ContentKind.RECOVERED);
                if (!fields.hasBody()) {
                    report.warning(Stage.INVENTORY, "EMPTY_RECOVERED_CONTENT", "Recovered file has no visible content: " + path, id);
                }
                recovered.put(id, new RecoveredContent(id, fields.title(), fields.body(), RECOVERED_MODULE_ID, path, fields.notes()));
                placements.put(path + "\u0000" + id, new OrganizationNode(id, null, List.of(), null, false));
                report.increment("recovered");
                report.info(Stage.INVENTORY, "CONTENT_RECOVERED", "Recovered unreferenced file " + path, id);
            } catch (MarkupParseException | IOException e) {
                failed.add(path);
                report.increment("filesNotRecovered");
                report.error(Stage.INVENTORY, "RECOVERY_FAILED", "Could not recover " + path + ": " + e.getMessage(), id);
            }
        }

        List<String> unplaced = new ArrayList<>();
        Set<String> placedRefs = new HashSet<>();
        collectRefs(manifest.root(), placedRefs);
        for (ResourceDescriptor resource : manifest.resources().values()) {
            if (!resource.type().isContent() || placedRefs.contains(resource.identifier())) continue;
            unplaced.add(resource.identifier());
            report.increment("unplacedResources");
            report.warning(Stage.INVENTORY, "UNPLACED_RESOURCE",
                    "Resource is not placed in any module; moved to " + properties.recoveredModuleTitle(), resource.identifier());
            String sortKey = Optional.ofNullable(resource.href()).orElse("") + "\u0000" + resource.identifier();
            placements.put(sortKey, new OrganizationNode("unplaced_" + resource.identifier(), resource.title(), List.of(), resource.identifier(), true));
        }

        OrganizationNode merged = manifest.root();
        if (!placements.isEmpty()) {
            OrganizationNode module = new OrganizationNode(RECOVERED_MODULE_ID, properties.recoveredModuleTitle(),
                    List.copyOf(placements.values()), null, false);
            List<OrganizationNode> modules = new ArrayList<>(manifest.root().children());
            modules.add(module);
            merged = manifest.root().withChildren(modules);
        }

        log.info("Reconciled inventory: unreferenced={}, recovered={}, failed={}, unplaced={}",
                unreferenced.size(), recovered.size(), failed.size(), unplaced.size());
        return new ReconciliationResult(merged, RECOVERED_MODULE_ID, Collections.unmodifiableMap(recovered),
                Collections.unmodifiableSortedSet(recognized), Collections.unmodifiableSortedSet(failed), List.copyOf(unplaced));
    }

    private void collectRefs(OrganizationNode node, Set<String> refs) {
        if (node.resourceRef() != null) refs.add(node.resourceRef());
        node.children().forEach(child -> collectRefs(child, refs));
    }
}
