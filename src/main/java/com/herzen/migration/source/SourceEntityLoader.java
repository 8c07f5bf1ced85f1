package com.herzen.migration.source;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.*;
import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import com.herzen.migration.extract.ExtractionModels.QuestionFields;
import com.herzen.migration.inventory.ContentReader;
import com.herzen.migration.inventory.CoursePaths;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import com.herzen.migration.manifest.ManifestModels.OrganizationNode;
import com.herzen.migration.manifest.ManifestModels.ResolvedManifest;
import com.herzen.migration.manifest.ManifestModels.ResourceDescriptor;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.source.SourceModels.*;
import org.dom4j.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.*;
import java.util.function.Predicate;

@Component
public class SourceEntityLoader {
    static final String ASSIGNMENT_SETTINGS = "assignment_settings.xml";
    static final String ASSESSMENT_META = "assessment_meta.xml";

    private static final Logger log = LoggerFactory.getLogger(SourceEntityLoader.class);

    private final MigrationProperties properties;
    private final MarkupExtractor extractor;
    private final QuestionExtractor questionExtractor;
    private final SlideDeckExtractor slideDecks;

    public SourceEntityLoader(MigrationProperties properties, MarkupExtractor extractor,
                              QuestionExtractor questionExtractor, SlideDeckExtractor slideDecks) {
        this.properties = properties;
        this.extractor = extractor;
        this.questionExtractor = questionExtractor;
        this.slideDecks = slideDecks;
    }

    public LoadedSources load(ResolvedManifest manifest, OrganizationNode mergedTree, Inventory inventory,
                              ContentReader reader, ReportAggregator report) {
        Map<String, SourceEntity> entities = new LinkedHashMap<>();
        SortedSet<String> failed = new TreeSet<>();
        for (OrganizationNode module : mergedTree.children()) {
            walk(module, module.identifier(), manifest, inventory, reader, report, entities, failed);
        }
        log.info("Loaded {} content resources, {} failed", entities.size(), failed.size());
        return new LoadedSources(Collections.unmodifiableMap(entities), Collections.unmodifiableSortedSet(failed));
    }

    private void walk(OrganizationNode node, String moduleId, ResolvedManifest manifest, Inventory inventory,
                      ContentReader reader, ReportAggregator report,
                      Map<String, SourceEntity> entities, Set<String> failed) {
        if (node.hasContent()) {
            String ref = node.resourceRef();
            Optional<ResourceDescriptor> resource = manifest.resource(ref);
            if (resource.isPresent() && resource.get().type().isContent() && !entities.containsKey(ref) && !failed.contains(ref)) {
                SourceEntity entity = load(resource.get(), moduleId, inventory, reader, report);
                if (entity == null) failed.add(ref);
                else entities.put(ref, entity);
            }
        }
        node.children().forEach(child -> walk(child, moduleId, manifest, inventory, reader, report, entities, failed));
    }

    SourceEntity load(ResourceDescriptor resource, String moduleId, Inventory inventory,
                      ContentReader reader, ReportAggregator report) {
        log.debug("Loading {} resource {}", resource.type(), resource.identifier());
        try {
            return switch (resource.type()) {
                case PAGE -> page(resource, moduleId, reader, report);
                case ASSIGNMENT -> assignment(resource, moduleId, inventory, reader, report);
                case QUIZ -> quiz(resource, moduleId, inventory, reader, report);
                default -> throw new IllegalArgumentException("Not a content resource: " + resource.type());
            };
        } catch (NoSuchFileException e) {
            report.error(Stage.EXTRACTION, "MISSING_CONTENT_FILE", "Content file not found: " + e.getFile(), resource.identifier());
        } catch (IOException e) {
            report.error(Stage.EXTRACTION, "CONTENT_UNREADABLE", "Content file cannot be read: " + e.getMessage(), resource.identifier());
        } catch (MarkupParseException e) {
            report.error(Stage.EXTRACTION, "CONTENT_PARSE_ERROR", e.getMessage(), resource.identifier());
        }
        return null;
    }

    private Page page(ResourceDescriptor resource, String moduleId, ContentReader reader,
                      ReportAggregator report) throws IOException, MarkupParseException {
        String path = primary(resource, properties::isRecognizedContent, report);
        if (path == null) return null;
        ExtractedFields fields = properties.isPresentation(path)
                ? slideDecks.extract(reader.readBytes(path))
                : extractor.extract(reader.read(path), MarkupFormat.of(path, properties), ContentKind.PAGE);
        return new Page(resource.identifier(), fields.title(), fields.body(),
                moduleId, Origin.MANIFEST, path);
    }

    private Assignment assignment(ResourceDescriptor resource, String moduleId, Inventory inventory,
                                  ContentReader reader, ReportAggregator report) throws IOException, MarkupParseException {
        String settingsPath = companion(resource, ASSIGNMENT_SETTINGS, firstMarkup(resource), inventory);
        String path = firstMarkup(resource);
        if (path == null) path = settingsPath;
        if (path == null) {
            report.error(Stage.EXTRACTION, "MISSING_CONTENT_FILE", "Assignment has no content file", resource.identifier());
            return null;
        }

        String title = null;
        String body = "";
        if (!path.equals(settingsPath)) {
            ExtractedFields fields = extractor.extract(reader.read(path), MarkupFormat.of(path, properties), ContentKind.ASSIGNMENT);
            title = fields.title();
            body = fields.body();
        }

        String dueAt = null;
        Double points = null;
        if (settingsPath != null) {
            MarkupDocument settings = companionDocument(resource, settingsPath, reader, report);
            if (settings != null) {
                ExtractedFields fields = extractor.extract(settings, ContentKind.ASSIGNMENT_SETTINGS);
                title = firstNonBlank(fields.title(), title);
                if (body == null || body.isBlank()) body = fields.body();
                dueAt = settings.firstContent("due_at").map(String::trim).orElse(null);
                points = settings.firstContent("points_possible").map(this::parseDouble).orElse(null);
            }
        }
        return new Assignment(resource.identifier(), title, body, moduleId,
                Origin.MANIFEST, path, dueAt, points);
    }

    private Quiz quiz(ResourceDescriptor resource, String moduleId, Inventory inventory,
                      ContentReader reader, ReportAggregator report) throws IOException, MarkupParseException {
        String path = primary(resource, p -> properties.isStructured(p)
                && !ASSESSMENT_META.equals(MigrationProperties.fileName(p)), report);
        if (path == null) return null;

        MarkupDocument document = extractor.parse(reader.read(path), MarkupFormat.STRUCTURED);
        ExtractedFields fields = extractor.extract(document, ContentKind.QUIZ);
        Element root = ((XmlMarkupDocument) document).root();
        String title = firstNonBlank(fields.title(),
                XmlSupport.firstSelfOrDescendant(root, "assessment").map(a -> XmlSupport.attribute(a, "title")).orElse(null));
        String description = fields.body();
        Integer timeLimit = null;
        Integer attempts = null;

        String metaPath = companion(resource, ASSESSMENT_META, path, inventory);
        if (metaPath != null) {
            MarkupDocument meta = companionDocument(resource, metaPath, reader, report);
            if (meta != null) {
                ExtractedFields metaFields = extractor.extract(meta, ContentKind.QUIZ);
                title = firstNonBlank(metaFields.title(), title);
                if (metaFields.hasBody()) description = metaFields.body();
                timeLimit = meta.firstContent("time_limit").map(this::parseInteger).orElse(null);
                attempts = meta.firstContent("allowed_attempts").map(this::parseInteger).orElse(null);
            }
        }

        List<Question> questions = new ArrayList<>();
        for (QuestionFields q : questionExtractor.extract((XmlMarkupDocument) document)) {
            List<Choice> choices = q.choices().stream().map(c -> new Choice(c.text(), c.correct())).toList();
            questions.add(new Question(resource.identifier() + "/" + q.identifier(), q.title(), q.text(), moduleId,
                    Origin.MANIFEST, path, q.kindLabel(), q.points(), choices));
        }
        return new Quiz(resource.identifier(), title, description, moduleId,
                Origin.MANIFEST, path, timeLimit, attempts, List.copyOf(questions));
    }

    private String primary(ResourceDescriptor resource, Predicate<String> usable, ReportAggregator report) {
        Optional<String> path = resource.paths().stream().filter(usable).findFirst();
        if (path.isEmpty()) {
            report.error(Stage.EXTRACTION, "MISSING_CONTENT_FILE", "Resource lists no usable content file", resource.identifier());
            return null;
        }
        return path.get();
    }

    private String firstMarkup(ResourceDescriptor resource) {
        return resource.paths().stream()
                .filter(properties::isMarkup)
                .findFirst()
                .orElse(null);
    }

    private String companion(ResourceDescriptor resource, String fileName, String beside, Inventory inventory) {
        Optional<String> listed = resource.paths().stream()
                .filter(p -> fileName.equals(MigrationProperties.fileName(p)))
                .findFirst();
        if (listed.isPresent()) return listed.get();
        String anchor = beside != null ? beside : resource.href();
        if (anchor == null) return null;
        String sibling = CoursePaths.sibling(anchor, fileName);
        return inventory.contains(sibling) ? sibling : null;
    }

    private MarkupDocument companionDocument(ResourceDescriptor resource, String path, ContentReader reader, ReportAggregator report) {
        try {
            return extractor.parse(reader.read(path), MarkupFormat.STRUCTURED);
        } catch (IOException e) {
            report.warning(Stage.EXTRACTION, "MISSING_REFERENCED_FILE", "Metadata file cannot be read: " + path, resource.identifier());
        } catch (MarkupParseException e) {
            report.warning(Stage.EXTRACTION, "METADATA_PARSE_ERROR", "Metadata file " + path + " ignored: " + e.getMessage(), resource.identifier());
        }
        return null;
    }

    private Double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric metadata value '{}'", value);
            return null;
        }
    }

    private Integer parseInteger(String value) {
        Double number = parseDouble(value);
        return number == null ? null : number.intValue();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first;
        return second == null || second.isBlank() ? null : second;
    }
}
