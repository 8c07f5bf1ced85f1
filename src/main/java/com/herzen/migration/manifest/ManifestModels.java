package com.herzen.migration.manifest;

import java.util.*;

public class ManifestModels {
    public enum ResourceType {
        PAGE, ASSIGNMENT, QUIZ, WEB_CONTENT, ASSET, UNKNOWN;

        public boolean isContent() {
            return this == PAGE || this == ASSIGNMENT || this == QUIZ;
        }
    }

    public record ResourceDescriptor(String identifier, ResourceType type, String rawType,
                                     String href, List<String> files, String title) {
        public List<String> paths() {
            LinkedHashSet<String> paths = new LinkedHashSet<>();
            if (href != null) paths.add(href);
            paths.addAll(files);
            return List.copyOf(paths);
        }
    }

    public record OrganizationNode(String identifier, String title, List<OrganizationNode> children,
                                   String resourceRef, boolean resolved) {
        public boolean isLeaf() {
            return children.isEmpty();
        }

        public boolean hasContent() {
            return resourceRef != null && resolved;
        }

        public OrganizationNode withChildren(List<OrganizationNode> newChildren) {
            return new OrganizationNode(identifier, title, List.copyOf(newChildren), resourceRef, resolved);
        }
    }

    public record ResolvedManifest(String courseId, String courseTitle,
                                   Map<String, ResourceDescriptor> resources,
                                   OrganizationNode root,
                                   Set<String> referencedPaths) {
        public Optional<ResourceDescriptor> resource(String identifier) {
            return identifier == null ? Optional.empty() : Optional.ofNullable(resources.get(identifier));
        }
    }
}
