package com.herzen.migration.manifest;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.XmlSupport;
import com.herzen.migration.inventory.CoursePaths;
import com.herzen.migration.manifest.ManifestModels.*;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

@Component
public class ManifestResolver {
    private static final Logger log = LoggerFactory.getLogger(ManifestResolver.class);
    private static final String ASSIGNMENT_SETTINGS = "assignment_settings.xml";

    private final MigrationProperties properties;

    public ManifestResolver(MigrationProperties properties) {
        this.properties = properties;
    }

    public ResolvedManifest resolve(Path courseRoot, ReportAggregator report) {
        Path manifestPath = courseRoot.resolve(properties.manifestFile());
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestResolutionException("MISSING_MANIFEST", "Manifest not found: " + manifestPath);
        }
        String xml;
        try {
            xml = Files.readString(manifestPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestResolutionException("MANIFEST_UNREADABLE", "Cannot read manifest: " + e.getMessage(), e);
        }
        return resolve(xml, report);
    }

    public ResolvedManifest resolve(String manifestXml, ReportAggregator report) {
        Document document;
        try {
            document = XmlSupport.read(manifestXml);
        } catch (DocumentException e) {
            throw new ManifestResolutionException("MANIFEST_PARSE_ERROR", "Manifest is not well-formed XML: " + e.getMessage(), e);
        }

        Element root = document.getRootElement();
        if (!"manifest".equals(root.getName())) {
            throw new ManifestResolutionException("INVALID_MANIFEST_SCHEMA", "Manifest root element is <" + root.getName() + ">, expected <manifest>");
        }
        Element organizations = root.element("organizations");
        Element resourcesSection = root.element("resources");
        if (organizations == null || resourcesSection == null) {
            throw new ManifestResolutionException("INVALID_MANIFEST_SCHEMA", "Manifest must contain <organizations> and <resources> sections");
        }

        String courseId = Optional.ofNullable(XmlSupport.attribute(root, "identifier")).orElse("course");
        String courseTitle = courseTitle(root);

        Map<String, ResourceDescriptor> resources = resourceMap(resourcesSection, report);
        OrganizationNode tree = organizationTree(organizations, courseTitle, resources, report);

        Set<String> referenced = new TreeSet<>();
        resources.values().forEach(r -> referenced.addAll(r.paths()));

        report.add("manifestResources", resources.size());
        report.add("manifestModules", tree.children().size());
        log.info("Manifest resolved: course={}, resources={}, modules={}", courseId, resources.size(), tree.children().size());
        return new ResolvedManifest(courseId, courseTitle, Collections.unmodifiableMap(resources), tree, Collections.unmodifiableSet(referenced));
    }

    private String courseTitle(Element root) {
        Element metadata = root.element("metadata");
        Optional<Element> title = XmlSupport.firstDescendant(metadata, "title");
        if (title.isPresent()) {
            Element t = title.get();
            String value = Optional.ofNullable(t.element("string")).map(XmlSupport::text).orElse(XmlSupport.text(t));
            if (!value.isBlank()) return value;
        }
        return "Untitled Course";
    }

    private Map<String, ResourceDescriptor> resourceMap(Element section, ReportAggregator report) {
        Map<String, ResourceDescriptor> resources = new LinkedHashMap<>();
        for (Element element : section.elements("resource")) {
            String id = XmlSupport.attribute(element, "identifier");
            if (id == null) {
                report.warning(Stage.MANIFEST, "RESOURCE_WITHOUT_ID", "Resource element without identifier ignored", null);
                continue;
            }
            String rawType = Optional.ofNullable(XmlSupport.attribute(element, "type")).orElse("");
            List<String> files = element.elements("file").stream()
                    .map(f -> CoursePaths.normalize(f.attributeValue("href")))
                    .filter(Objects::nonNull)
                    .distinct()
                    .toList();
            String href = CoursePaths.normalize(element.attributeValue("href"));
            if (href == null && !files.isEmpty()) href = files.get(0);
            String title = XmlSupport.attribute(element, "title");
            if (title == null && element.element("title") != null) title = XmlSupport.text(element.element("title"));

            ResourceDescriptor descriptor = new ResourceDescriptor(id, inferType(rawType, href, files), rawType, href, files,
                    title == null || title.isBlank() ? null : title);
            if (resources.containsKey(id)) {
                report.warning(Stage.MANIFEST, "DUPLICATE_RESOURCE", "Duplicate resource identifier, last definition wins: " + id, id);
                resources.remove(id);
            }
            resources.put(id, descriptor);
        }
        return resources;
    }

    ResourceType inferType(String rawType, String href, List<String> files) {
        String type = rawType.toLowerCase(Locale.ROOT);
        List<String> paths = new ArrayList<>();
        if (href != null) paths.add(href);
        paths.addAll(files);
        if (!paths.isEmpty() && paths.stream().allMatch(this::underIgnoredDirectory)) return ResourceType.UNKNOWN;
        if (type.contains("question-bank")) return ResourceType.UNKNOWN;
        if (href != null && href.endsWith("assessment_meta.xml")) return ResourceType.UNKNOWN;
        if (type.contains("assessment")) return ResourceType.QUIZ;
        if (type.contains("assignment")) return ResourceType.ASSIGNMENT;
        if (type.contains("associatedcontent")) {
            boolean assignment = paths.stream().anyMatch(p -> properties.isMarkup(p)
                    || ASSIGNMENT_SETTINGS.equals(MigrationProperties.fileName(p)));
            return assignment ? ResourceType.ASSIGNMENT : ResourceType.UNKNOWN;
        }
        if (type.contains("imswl")) return ResourceType.WEB_CONTENT;
        if (type.contains("webcontent")) {
            boolean page = href != null && (properties.isPresentation(href)
                    || properties.isRecognizedContent(href) && !href.startsWith(properties.assetSourceDirectory() + "/"));
            return page ? ResourceType.PAGE : ResourceType.ASSET;
        }
        return ResourceType.UNKNOWN;
    }

    private boolean underIgnoredDirectory(String path) {
        String[] segments = path.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (properties.ignoredDirectories().contains(segments[i])) return true;
        }
        return false;
    }

    private OrganizationNode organizationTree(Element organizations, String courseTitle,
                                              Map<String, ResourceDescriptor> resources, ReportAggregator report) {
        Element organization = organizations.element("organization");
        if (organization == null) {
            report.warning(Stage.MANIFEST, "NO_ORGANIZATION", "No organization element found; course has no module structure", null);
            return new OrganizationNode("root", courseTitle, List.of(), null, false);
        }

        List<Element> items = organization.elements("item");
        if (items.size() == 1 && !items.get(0).elements("item").isEmpty()) {
            log.debug("Flattening wrapper item {}", items.get(0).attributeValue("identifier"));
            items = items.get(0).elements("item");
        }

        List<OrganizationNode> modules = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            modules.add(node(items.get(i), "module-" + i, resources, report));
        }
        String rootId = Optional.ofNullable(XmlSupport.attribute(organization, "identifier")).orElse("root");
        return new OrganizationNode(rootId, courseTitle, List.copyOf(modules), null, false);
    }

    private OrganizationNode node(Element item, String fallbackId,
                                  Map<String, ResourceDescriptor> resources, ReportAggregator report) {
        String id = Optional.ofNullable(XmlSupport.attribute(item, "identifier")).orElse(fallbackId);
        Element titleElement = item.element("title");
        String title = titleElement == null || XmlSupport.text(titleElement).isBlank() ? null : XmlSupport.text(titleElement);
        String ref = XmlSupport.attribute(item, "identifierref");

        boolean resolved = ref != null && resources.containsKey(ref);
        if (ref != null && !resolved) {
            report.warning(Stage.MANIFEST, "UNRESOLVED_RESOURCE_REF", "Item references unknown resource " + ref, id);
        }

        List<Element> childItems = item.elements("item");
        List<OrganizationNode> children = new ArrayList<>();
        for (int i = 0; i < childItems.size(); i++) {
            children.add(node(childItems.get(i), id + "-" + i, resources, report));
        }
        return new OrganizationNode(id, title, List.copyOf(children), ref, resolved);
    }
}
