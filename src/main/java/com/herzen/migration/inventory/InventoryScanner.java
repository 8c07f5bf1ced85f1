package com.herzen.migration.inventory;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.export.MigrationExporter;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

@Component
public class InventoryScanner {
    private static final Logger log = LoggerFactory.getLogger(InventoryScanner.class);

    private final MigrationProperties properties;

    public InventoryScanner(MigrationProperties properties) {
        this.properties = properties;
    }

    public Inventory scan(Path courseRoot, Path outputDir) throws IOException {
        Set<String> excluded = new LinkedHashSet<>();
        excluded.add(properties.outputDirectory());
        Set<String> exportFiles = Set.of();
        if (outputDir != null) {
            Path root = courseRoot.toAbsolutePath().normalize();
            Path output = outputDir.toAbsolutePath().normalize();
            if (output.equals(root)) {
                exportFiles = Set.of(MigrationExporter.GRAPH_FILE, MigrationExporter.REPORT_FILE);
            } else if (output.startsWith(root)) {
                excluded.add(CoursePaths.relative(root, output));
            }
        }
        Set<String> skippedFiles = exportFiles;
        try (Stream<Path> walk = Files.walk(courseRoot)) {
            List<String> files = walk.filter(Files::isRegularFile)
                    .map(p -> CoursePaths.relative(courseRoot, p))
                    .filter(p -> !skippedFiles.contains(p))
                    .filter(p -> included(p, excluded))
                    .toList();
            log.info("Scanned {} files under {}", files.size(), courseRoot);
            return Inventory.of(files);
        }
    }

    boolean included(String relativePath, Set<String> excludedDirectories) {
        if (excludedDirectories.stream().anyMatch(dir -> relativePath.startsWith(dir + "/"))) return false;
        List<String> segments = Arrays.asList(relativePath.split("/"));
        List<String> directories = segments.subList(0, segments.size() - 1);
        return directories.stream().noneMatch(properties.ignoredDirectories()::contains);
    }
}
