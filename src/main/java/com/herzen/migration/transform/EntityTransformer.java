package com.herzen.migration.transform;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.inventory.InventoryModels.ReconciliationResult;
import com.herzen.migration.manifest.ManifestModels.OrganizationNode;
import com.herzen.migration.manifest.ManifestModels.ResolvedManifest;
import com.herzen.migration.manifest.ManifestModels.ResourceDescriptor;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.source.SourceModels;
import com.herzen.migration.source.SourceModels.LoadedSources;
import com.herzen.migration.source.SourceModels.Origin;
import com.herzen.migration.source.SourceModels.RecoveredContent;
import com.herzen.migration.source.SourceModels.SourceEntity;
import com.herzen.migration.transform.MappingRules.MappingRule;
import com.herzen.migration.transform.TargetModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class EntityTransformer {
    static final String UNTITLED_MODULE = "Untitled Module";
    static final String UNTITLED_ITEM = "Untitled Item";
    static final int DEFAULT_ATTEMPTS = 10;
    static final int DEFAULT_PASSING_GRADE = 80;
    static final double PASS_RATIO = 0.6;

    private static final Logger log = LoggerFactory.getLogger(EntityTransformer.class);

    private final MigrationProperties properties;
    private final MappingRules mappingRules;

    public EntityTransformer(MigrationProperties properties, MappingRules mappingRules) {
        this.properties = properties;
        this.mappingRules = mappingRules;
    }

    public TargetCourseGraph transform(ResolvedManifest manifest, ReconciliationResult reconciliation,
                                       LoadedSources sources, ReportAggregator report) {
        Course course = new Course(TargetModels.COURSE_PREFIX + manifest.courseId(), null, manifest.courseTitle(), 0, "",
                manifest.courseId(), properties.manifestFile());

        List<Topic> topics = new ArrayList<>();
        for (OrganizationNode module : reconciliation.mergedTree().children()) {
            String topicId = TargetModels.TOPIC_PREFIX + module.identifier();
            List<TopicItem> items = new ArrayList<>();
            if (module.resourceRef() != null || reconciliation.recoveredFor(module.identifier()).isPresent()) {
                item(module, topicId, manifest, reconciliation, sources, report, items);
            }
            collect(module.children(), topicId, manifest, reconciliation, sources, report, items);
            topics.add(new Topic(topicId, course.id(), TitleResolver.resolve(null, module.title(), null, UNTITLED_MODULE),
                    topics.size(), "", module.identifier(), null, List.copyOf(items)));
            report.increment("topics");
        }

        TargetCourseGraph graph = new TargetCourseGraph(course, List.copyOf(topics));
        log.info("Transformed course {}: topics={}, lessons={}, quizzes={}, assignments={}", course.id(),
                topics.size(), graph.lessons().size(), graph.quizzes().size(), graph.assignments().size());
        return graph;
    }

    private void collect(List<OrganizationNode> nodes, String topicId, ResolvedManifest manifest,
                         ReconciliationResult reconciliation, LoadedSources sources,
                         ReportAggregator report, List<TopicItem> items) {
        for (OrganizationNode node : nodes) {
            if (node.isLeaf()) {
                item(node, topicId, manifest, reconciliation, sources, report, items);
                continue;
            }
            report.info(Stage.TRANSFORM, "FLATTENED_SUBHEADER",
                    "Nested items of " + Optional.ofNullable(node.title()).orElse(node.identifier()) + " moved into the enclosing topic", node.identifier());
            if (node.resourceRef() != null) item(node, topicId, manifest, reconciliation, sources, report, items);
            collect(node.children(), topicId, manifest, reconciliation, sources, report, items);
        }
    }

    private void item(OrganizationNode node, String topicId, ResolvedManifest manifest,
                      ReconciliationResult reconciliation, LoadedSources sources,
                      ReportAggregator report, List<TopicItem> items) {
        int order = items.size();
        Optional<RecoveredContent> recovered = reconciliation.recoveredFor(node.identifier());
        if (recovered.isPresent()) {
            items.add(recoveredLesson(recovered.get(), topicId, order));
            report.increment("lessons");
            return;
        }
        if (node.resourceRef() == null) {
            report.info(Stage.TRANSFORM, "TEXT_HEADER", "Text-only item carries no content: " + node.title(), node.identifier());
            return;
        }
        if (!node.resolved()) {
            log.debug("Skipping node {} with dangling reference {}", node.identifier(), node.resourceRef());
            return;
        }

        ResourceDescriptor resource = manifest.resources().get(node.resourceRef());
        if (!resource.type().isContent()) {
            report.warning(Stage.TRANSFORM, "UNSUPPORTED_ITEM",
                    "Item of type " + resource.type() + " (" + resource.rawType() + ") has no course graph counterpart", node.identifier());
            return;
        }
        Optional<SourceEntity> entity = sources.entity(resource.identifier());
        if (entity.isEmpty()) {
            log.debug("Skipping node {}: resource {} failed to load", node.identifier(), resource.identifier());
            return;
        }

        SourceEntity source = entity.get();
        if (source instanceof SourceModels.Page page) {
            items.add(new Lesson(TargetModels.LESSON_PREFIX + node.identifier(), topicId,
                    TitleResolver.resolve(page.title(), node.title(), page.sourcePath(), UNTITLED_ITEM), order,
                    page.content(), page.id(), page.sourcePath(), Origin.MANIFEST, null));
            report.increment("lessons");
        } else if (source instanceof SourceModels.Assignment assignment) {
            items.add(assignment(assignment, node, topicId, order, report));
            report.increment("assignments");
        } else if (source instanceof SourceModels.Quiz quiz) {
            items.add(quiz(quiz, node, topicId, order, report));
            report.increment("quizzes");
        }
    }

    private Lesson recoveredLesson(RecoveredContent content, String topicId, int order) {
        return new Lesson(TargetModels.LESSON_PREFIX + content.id(), topicId,
                TitleResolver.resolve(content.title(), null, content.sourcePath(), UNTITLED_ITEM), order,
                content.content(), content.id(), content.sourcePath(), Origin.RECOVERED, content.notes());
    }

    private Assignment assignment(SourceModels.Assignment source, OrganizationNode node, String topicId,
                                  int order, ReportAggregator report) {
        String id = TargetModels.ASSIGNMENT_PREFIX + node.identifier();
        boolean defaulted = source.dueAt() == null || source.points() == null;
        if (defaulted) {
            List<String> missing = new ArrayList<>();
            if (source.dueAt() == null) missing.add("due date");
            if (source.points() == null) missing.add("points");
            report.warning(Stage.TRANSFORM, "ASSIGNMENT_METADATA_DEFAULTED",
                    "Assignment has no " + String.join(" or ", missing) + "; defaults applied", id);
        }
        double total = source.points() == null ? 0 : source.points();
        return new Assignment(id, topicId, TitleResolver.resolve(source.title(), node.title(), source.sourcePath(), UNTITLED_ITEM),
                order, source.content(), source.id(), source.sourcePath(),
                source.dueAt(), total, total * PASS_RATIO, defaulted);
    }

    private Quiz quiz(SourceModels.Quiz source, OrganizationNode node, String topicId,
                      int order, ReportAggregator report) {
        String id = TargetModels.QUIZ_PREFIX + node.identifier();
        List<Question> questions = new ArrayList<>();
        for (SourceModels.Question question : source.questions()) {
            questions.add(question(question, id, node.identifier() + "/" + questions.size(), questions.size(), report));
        }
        int timeLimit = source.timeLimitMinutes() == null || source.timeLimitMinutes() < 0 ? 0 : source.timeLimitMinutes();
        int attempts = source.allowedAttempts() == null ? DEFAULT_ATTEMPTS : Math.max(source.allowedAttempts(), 0);
        return new Quiz(id, topicId, TitleResolver.resolve(source.title(), node.title(), source.sourcePath(), UNTITLED_ITEM),
                order, source.content(), source.id(), source.sourcePath(),
                timeLimit, attempts, DEFAULT_PASSING_GRADE, List.copyOf(questions));
    }

    private Question question(SourceModels.Question source, String quizId, String localId, int order, ReportAggregator report) {
        String id = TargetModels.QUESTION_PREFIX + localId;
        String label = source.sourceKind() == null || source.sourceKind().isBlank() ? "unknown" : source.sourceKind();
        MappingRule rule = mappingRules.rule(source.sourceKind());
        report.increment("questions");
        report.increment("questionKind." + label);
        if (rule.fallback()) {
            report.warning(Stage.TRANSFORM, "QUESTION_KIND_FALLBACK",
                    "Question kind " + label + " converted to " + rule.target().label() + "; review required", id);
        }

        List<Answer> answers = new ArrayList<>();
        for (SourceModels.Choice choice : source.choices()) {
            answers.add(new Answer(TargetModels.ANSWER_PREFIX + localId + "/" + answers.size(), id, answers.size(),
                    choice.text(), choice.correct()));
        }
        return new Question(id, quizId, source.title(), order, source.content(), source.id(), source.sourcePath(),
                label, rule.target(), rule.confidence(), source.points(), List.copyOf(answers));
    }
}
