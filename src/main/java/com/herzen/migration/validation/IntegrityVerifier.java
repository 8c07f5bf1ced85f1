package com.herzen.migration.validation;

import com.herzen.migration.inventory.InventoryModels.ReconciliationResult;
import com.herzen.migration.manifest.ManifestModels.OrganizationNode;
import com.herzen.migration.manifest.ManifestModels.ResolvedManifest;
import com.herzen.migration.manifest.ManifestModels.ResourceDescriptor;
import com.herzen.migration.manifest.ManifestModels.ResourceType;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.source.SourceModels.LoadedSources;
import com.herzen.migration.transform.TargetModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class IntegrityVerifier {
    private static final Logger log = LoggerFactory.getLogger(IntegrityVerifier.class);

    public void verify(TargetCourseGraph graph, ResolvedManifest manifest, ReconciliationResult reconciliation,
                       LoadedSources sources, ReportAggregator report) {
        List<Row> ids = new ArrayList<>();
        List<Row> orders = new ArrayList<>();
        Course course = graph.course();
        ids.add(new Row(course.id(), null, "course"));

        for (Topic topic : graph.topics()) {
            ids.add(new Row(topic.id(), course.id(), "topic"));
            orders.add(new Row(course.id() + "#" + topic.order(), topic.id(), "topic"));
            parent(topic.id(), topic.parentId(), course.id(), report);
            for (TopicItem item : topic.items()) {
                ids.add(new Row(item.id(), topic.id(), "item"));
                orders.add(new Row(topic.id() + "#" + item.order(), item.id(), "item"));
                parent(item.id(), item.parentId(), topic.id(), report);
                if (!(item instanceof Quiz quiz)) continue;
                for (Question question : quiz.questions()) {
                    ids.add(new Row(question.id(), quiz.id(), "question"));
                    orders.add(new Row(quiz.id() + "#" + question.order(), question.id(), "question"));
                    parent(question.id(), question.parentId(), quiz.id(), report);
                    for (Answer answer : question.answers()) {
                        ids.add(new Row(answer.id(), question.id(), "answer"));
                        orders.add(new Row(question.id() + "#" + answer.order(), answer.id(), "answer"));
                        parent(answer.id(), answer.parentId(), question.id(), report);
                    }
                }
            }
        }

        duplicate(ids, "DUPLICATE_TARGET_ID", r -> "Duplicate " + r.block() + " id: " + r.key(), Row::key, report);
        duplicate(orders, "DUPLICATE_ORDER_KEY", r -> "Duplicate " + r.block() + " order key " + r.key(), Row::owner, report);

        lessonCount(graph, manifest, reconciliation, sources, report);
        completeness(graph, manifest, reconciliation, report);
        log.info("Integrity verified: {} ids, {} errors so far", ids.size(), report.errorEntityIds().size());
    }

    private void parent(String id, String parentId, String expected, ReportAggregator report) {
        if (!Objects.equals(parentId, expected)) {
            report.error(Stage.INTEGRITY, "DANGLING_PARENT", id + " points to parent " + parentId + ", expected " + expected, id);
        }
    }

    private void lessonCount(TargetCourseGraph graph, ResolvedManifest manifest, ReconciliationResult reconciliation,
                             LoadedSources sources, ReportAggregator report) {
        int expected = 0;
        Deque<OrganizationNode> pending = new ArrayDeque<>(reconciliation.mergedTree().children());
        while (!pending.isEmpty()) {
            OrganizationNode node = pending.pop();
            pending.addAll(node.children());
            if (reconciliation.recoveredFor(node.identifier()).isPresent()) {
                expected++;
            } else if (node.hasContent()
                    && manifest.resource(node.resourceRef()).map(ResourceDescriptor::type).orElse(null) == ResourceType.PAGE
                    && sources.entity(node.resourceRef()).isPresent()) {
                expected++;
            }
        }
        int actual = graph.lessons().size();
        if (actual != expected) {
            report.warning(Stage.INTEGRITY, "LESSON_COUNT_MISMATCH",
                    "Expected " + expected + " lessons from page placements and recovered files, found " + actual, graph.course().id());
        }
    }

    private void completeness(TargetCourseGraph graph, ResolvedManifest manifest, ReconciliationResult reconciliation,
                              ReportAggregator report) {
        Set<String> producedSources = graph.items().map(TopicItem::sourceId).collect(Collectors.toSet());
        Set<String> producedPaths = graph.items().map(TopicItem::sourcePath).filter(Objects::nonNull).collect(Collectors.toSet());
        Set<String> errored = report.errorEntityIds();

        for (ResourceDescriptor resource : manifest.resources().values()) {
            if (!resource.type().isContent()) continue;
            if (producedSources.contains(resource.identifier()) || errored.contains(resource.identifier())) continue;
            report.warning(Stage.INTEGRITY, "CONTENT_UNACCOUNTED",
                    "Content resource was neither migrated nor reported as failed: " + resource.identifier(), resource.identifier());
        }
        for (String path : reconciliation.recognizedUnreferenced()) {
            if (producedPaths.contains(path) || reconciliation.failedPaths().contains(path)) continue;
            report.warning(Stage.INTEGRITY, "CONTENT_UNACCOUNTED",
                    "Recovered file was neither migrated nor reported as failed: " + path, path);
        }
    }

    private void duplicate(List<Row> rows, String code, Function<Row, String> message,
                           Function<Row, String> entity, ReportAggregator report) {
        Map<String, Long> counts = rows.stream().collect(Collectors.groupingBy(Row::key, Collectors.counting()));
        rows.forEach(r -> {
            if (r.key() != null && counts.getOrDefault(r.key(), 0L) > 1) {
                report.error(Stage.INTEGRITY, code, message.apply(r), entity.apply(r));
            }
        });
    }

    private record Row(String key, String owner, String block) {}
}
