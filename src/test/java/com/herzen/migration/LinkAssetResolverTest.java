package com.herzen.migration;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.HtmlCleaner;
import com.herzen.migration.inventory.InventoryModels.Inventory;
import com.herzen.migration.link.LinkAssetResolver;
import com.herzen.migration.report.ReportAggregator;
import com.herzen.migration.source.SourceModels.Origin;
import com.herzen.migration.transform.MappingConfidence;
import com.herzen.migration.transform.TargetModels.*;
import com.herzen.migration.transform.TargetQuestionKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinkAssetResolverTest {
    private final MigrationProperties properties = MigrationProperties.defaults();
    private final LinkAssetResolver resolver = new LinkAssetResolver(properties, new HtmlCleaner(properties));

    @Test
    void rewritesPlaceholdersAndChecksAssetsAgainstInventory() {
        String html = "<p><img src=\"../../assets/logo.png\">"
                + "<a href=\"$IMS-CC-FILEBASE$/docs/My%20File.pdf\">doc</a>"
                + "<a href=\"../../assets/missing.pdf?x=1\">gone</a>"
                + "<a href=\"https://example.com\">ext</a></p>";
        var lesson = new Lesson("lesson:i1", "topic:m1", "Intro", 0, html, "page1", "wiki_content/intro.html", Origin.MANIFEST, null);
        var question = new Question("question:i2/0", "quiz:i2", "Q", 0, "<img src=\"$IMS-CC-FILEBASE$/chart.png\">",
                "quiz1/q1", "quiz1/qti.xml", "multiple_choice_question", TargetQuestionKind.MULTIPLE_CHOICE,
                MappingConfidence.DIRECT, 1.0,
                List.of(new Answer("answer:i2/0/0", "question:i2/0", 0, "<img src=\"../../assets/logo.png\">", true)));
        var quiz = new Quiz("quiz:i2", "topic:m1", "Check", 1, "", "quiz1", "quiz1/qti.xml", 0, 10, 80, List.of(question));
        var graph = new TargetCourseGraph(new Course("course:c", null, "Course", 0, "", "c", "imsmanifest.xml"),
                List.of(new Topic("topic:m1", "course:c", "Week 1", 0, "", "m1", null, List.of(lesson, quiz))));
        var inventory = Inventory.of(List.of("web_resources/logo.png", "web_resources/docs/My File.pdf"));
        var report = new ReportAggregator();

        var resolved = resolver.resolve(graph, inventory, report);

        var rewrittenLesson = (Lesson) resolved.topics().get(0).items().get(0);
        assertTrue(rewrittenLesson.content().contains("href=\"../../assets/docs/My%20File.pdf\""));
        assertFalse(rewrittenLesson.content().contains("IMS-CC-FILEBASE"));
        assertTrue(lesson.content().contains("$IMS-CC-FILEBASE$"));

        var rewrittenQuiz = (Quiz) resolved.topics().get(0).items().get(1);
        assertEquals("<img src=\"../../assets/chart.png\">", rewrittenQuiz.questions().get(0).content());

        var frozen = report.freeze();
        assertEquals(3, frozen.counter("assetsResolved"));
        assertEquals(2, frozen.counter("assetsMissing"));
        var missing = frozen.eventsWithCode("MISSING_ASSET");
        assertEquals(List.of("lesson:i1", "question:i2/0"), missing.stream().map(e -> e.entityId()).toList());
    }
}
