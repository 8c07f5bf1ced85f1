package com.herzen.migration.inventory;

import com.herzen.migration.manifest.ManifestModels.OrganizationNode;
import com.herzen.migration.source.SourceModels.RecoveredContent;

import java.util.*;

public class InventoryModels {
    public record Inventory(SortedSet<String> files) {
        public Inventory {
            files = Collections.unmodifiableSortedSet(new TreeSet<>(files));
        }

        public static Inventory of(Collection<String> paths) {
            return new Inventory(new TreeSet<>(paths));
        }

        public boolean contains(String path) {
            return files.contains(path);
        }
    }

    public record ReconciliationResult(OrganizationNode mergedTree,
                                       String recoveredModuleId,
                                       Map<String, RecoveredContent> recovered,
                                       SortedSet<String> recognizedUnreferenced,
                                       SortedSet<String> failedPaths,
                                       List<String> unplacedResourceIds) {
        public Optional<RecoveredContent> recoveredFor(String nodeId) {
            return Optional.ofNullable(recovered.get(nodeId));
        }
    }
}
