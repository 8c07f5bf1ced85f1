package com.herzen.migration.source;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

public class SourceModels {
    public enum Origin { MANIFEST, RECOVERED }

    public sealed interface SourceEntity permits Page, Assignment, Quiz, Question, RecoveredContent {
        String id();

        String title();

        String content();

        String parentModuleId();

        Origin origin();

        String sourcePath();
    }

    public record Page(String id, String title, String content, String parentModuleId,
                       Origin origin, String sourcePath) implements SourceEntity {}

    public record Assignment(String id, String title, String content, String parentModuleId,
                             Origin origin, String sourcePath,
                             String dueAt, Double points) implements SourceEntity {}

    public record Quiz(String id, String title, String content, String parentModuleId,
                       Origin origin, String sourcePath,
                       Integer timeLimitMinutes, Integer allowedAttempts,
                       List<Question> questions) implements SourceEntity {}

    public record Question(String id, String title, String content, String parentModuleId,
                           Origin origin, String sourcePath,
                           String sourceKind, double points, List<Choice> choices) implements SourceEntity {}

    public record Choice(String text, boolean correct) {}

    public record RecoveredContent(String id, String title, String content, String parentModuleId,
                                   String sourcePath, String notes) implements SourceEntity {
        @Override
        public Origin origin() {
            return Origin.RECOVERED;
        }
    }

    public record LoadedSources(Map<String, SourceEntity> entities, SortedSet<String> failedResourceIds) {
        public Optional<SourceEntity> entity(String resourceId) {
            return Optional.ofNullable(entities.get(resourceId));
        }
    }
}
