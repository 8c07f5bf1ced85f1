package com.herzen.migration;

import com.herzen.migration.export.MigrationExporter;
import com.herzen.migration.report.ReportModels.ReportEvent;
import com.herzen.migration.report.ReportModels.Severity;
import com.herzen.migration.report.ReportModels.Stage;
import com.herzen.migration.report.ReportModels.TerminalStatus;
import com.herzen.migration.service.MigrationService;
import com.herzen.migration.source.SourceModels.Origin;
import com.herzen.migration.transform.MappingConfidence;
import com.herzen.migration.transform.TargetModels.*;
import com.herzen.migration.transform.TargetQuestionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MigrationServiceTest {
    @Autowired
    private MigrationService service;

    @TempDir
    Path root;

    @Test
    void migratesPageAndRecoversUnreferencedNotes() {
        CourseFixtures.welcomeCourse(root);

        var outcome = service.run(root);

        var report = outcome.report();
        assertEquals(TerminalStatus.SUCCESS, report.status());
        assertEquals(0, report.count(Severity.ERROR));
        assertEquals(0, report.count(Severity.WARNING));

        var graph = outcome.graph();
        assertEquals("Intro Course", graph.course().title());
        assertEquals(List.of("Week 1", "Recovered Content"), graph.topics().stream().map(Topic::title).toList());

        var welcome = (Lesson) graph.topics().get(0).items().get(0);
        assertEquals("Welcome", welcome.title());
        assertEquals("lesson:i1", welcome.id());
        assertEquals("topic:m1", welcome.parentId());
        assertTrue(welcome.content().contains("<p>Hello class</p>"));
        assertTrue(welcome.content().contains("src=\"../../assets/logo.png\""));

        var notes = (Lesson) graph.topics().get(1).items().get(0);
        assertEquals("Notes", notes.title());
        assertEquals(Origin.RECOVERED, notes.origin());
        assertEquals("notes.xml", notes.sourcePath());
        assertEquals("Some notes about the course", notes.content());

        assertEquals(2, report.counter("lessons"));
        assertEquals(1, report.counter("recovered"));
        assertEquals(1, report.counter("assetsResolved"));
    }

    @Test
    void rerunsProduceIdenticalOutput(@TempDir Path firstOut, @TempDir Path secondOut) throws Exception {
        CourseFixtures.welcomeCourse(root);

        var first = service.runAndExport(root, firstOut);
        var second = service.runAndExport(root, secondOut);

        assertEquals(codes(first.report().events()), codes(second.report().events()));
        for (String file : List.of(MigrationExporter.GRAPH_FILE, MigrationExporter.REPORT_FILE)) {
            assertArrayEquals(Files.readAllBytes(firstOut.resolve(file)), Files.readAllBytes(secondOut.resolve(file)), file);
        }
    }

    @Test
    void defaultOutputDirectoryIsNotScannedOnRerun() throws Exception {
        CourseFixtures.welcomeCourse(root);
        Path output = root.resolve("tutor_lms_output");

        service.runAndExport(root, null);
        byte[] firstGraph = Files.readAllBytes(output.resolve(MigrationExporter.GRAPH_FILE));
        byte[] firstReport = Files.readAllBytes(output.resolve(MigrationExporter.REPORT_FILE));
        var second = service.runAndExport(root, null);

        assertEquals(1, second.report().counter("recovered"));
        assertArrayEquals(firstGraph, Files.readAllBytes(output.resolve(MigrationExporter.GRAPH_FILE)));
        assertArrayEquals(firstReport, Files.readAllBytes(output.resolve(MigrationExporter.REPORT_FILE)));
    }

    @Test
    void customOutputDirectoryInsideRootIsNotScannedOnRerun() throws Exception {
        CourseFixtures.welcomeCourse(root);
        Path output = root.resolve("export");

        var first = service.runAndExport(root, output);
        byte[] firstGraph = Files.readAllBytes(output.resolve(MigrationExporter.GRAPH_FILE));
        byte[] firstReport = Files.readAllBytes(output.resolve(MigrationExporter.REPORT_FILE));
        var second = service.runAndExport(root, output);

        assertEquals(codes(first.report().events()), codes(second.report().events()));
        assertEquals(first.report().counters(), second.report().counters());
        assertTrue(second.report().eventsWithCode("UNREFERENCED_FILE").isEmpty());
        assertArrayEquals(firstGraph, Files.readAllBytes(output.resolve(MigrationExporter.GRAPH_FILE)));
        assertArrayEquals(firstReport, Files.readAllBytes(output.resolve(MigrationExporter.REPORT_FILE)));
    }

    @Test
    void canvasCourseSettingsResourceDoesNotDegradeTheRun() {
        CourseFixtures.write(root, "imsmanifest.xml", CourseFixtures.manifest("""
                        <item identifier="m1"><title>Week 1</title>
                          <item identifier="i1" identifierref="welcome"><title>Welcome item</title></item>
                        </item>
                """, """
                    <resource identifier="welcome" type="webcontent" href="wiki_content/welcome.html">
                      <file href="wiki_content/welcome.html"/>
                    </resource>
                    <resource identifier="logo" type="webcontent" href="web_resources/logo.png">
                      <file href="web_resources/logo.png"/>
                    </resource>
                    <resource identifier="settings" type="associatedcontent/imscc_xmlv1p1/learning-application-resource" href="course_settings/canvas_export.txt">
                      <file href="course_settings/course_settings.xml"/>
                      <file href="course_settings/module_meta.xml"/>
                      <file href="course_settings/files_meta.xml"/>
                      <file href="course_settings/canvas_export.txt"/>
                    </resource>
                """));
        CourseFixtures.write(root, "wiki_content/welcome.html", CourseFixtures.WELCOME_PAGE);
        CourseFixtures.write(root, "web_resources/logo.png", "png");
        CourseFixtures.write(root, "course_settings/course_settings.xml", "<course identifier=\"course_1\"><title>Intro Course</title></course>");
        CourseFixtures.write(root, "course_settings/module_meta.xml", "<modules/>");
        CourseFixtures.write(root, "course_settings/files_meta.xml", "<fileMeta/>");
        CourseFixtures.write(root, "course_settings/canvas_export.txt", "Q: What did the panda say when he was forced out of his natural habitat?");

        var outcome = service.run(root);

        var report = outcome.report();
        assertEquals(TerminalStatus.SUCCESS, report.status());
        assertEquals(0, report.count(Severity.ERROR));
        assertEquals(0, report.count(Severity.WARNING));
        assertEquals(List.of("Week 1"), outcome.graph().topics().stream().map(Topic::title).toList());
        assertEquals(0, report.counter("unplacedResources"));
    }

    @Test
    void convertsSlideDecksFromManifestAndFromDisk() {
        CourseFixtures.write(root, "imsmanifest.xml", CourseFixtures.manifest("""
                        <item identifier="m1"><title>Week 1</title>
                          <item identifier="i1" identifierref="deck"><title>Lecture</title></item>
                        </item>
                """, """
                    <resource identifier="deck" type="webcontent" href="web_resources/lecture_one.pptx">
                      <file href="web_resources/lecture_one.pptx"/>
                    </resource>
                """));
        CourseFixtures.write(root, "web_resources/lecture_one.pptx",
                CourseFixtures.slideDeck("Variables", List.of(List.of("Names hold values")), null));
        CourseFixtures.write(root, "extras/week_two.pptx",
                CourseFixtures.slideDeck("Functions", List.of(List.of("Define", "Call")), "Demo in the console"));

        var outcome = service.run(root);

        var report = outcome.report();
        assertEquals(TerminalStatus.SUCCESS, report.status());
        var topics = outcome.graph().topics();
        assertEquals(List.of("Week 1", "Recovered Content"), topics.stream().map(Topic::title).toList());

        var lecture = (Lesson) topics.get(0).items().get(0);
        assertEquals("lesson:i1", lecture.id());
        assertEquals("Lecture", lecture.title());
        assertEquals(Origin.MANIFEST, lecture.origin());
        assertTrue(lecture.content().contains("<h2>Variables 1</h2><p>Names hold values</p>"), lecture.content());

        var recovered = (Lesson) topics.get(1).items().get(0);
        assertEquals("Week Two", recovered.title());
        assertEquals(Origin.RECOVERED, recovered.origin());
        assertEquals("extras/week_two.pptx", recovered.sourcePath());
        assertTrue(recovered.content().contains("<ul><li>Define</li><li>Call</li></ul>"), recovered.content());
        assertEquals("<p>Slide 1: Demo in the console</p>", recovered.notes());

        assertEquals(2, report.counter("lessons"));
        assertEquals(1, report.counter("recovered"));
    }

    @Test
    void missingManifestFailsWithoutGraph(@TempDir Path out) {
        CourseFixtures.write(root, "wiki_content/page.html", "<p>orphan</p>");

        var outcome = service.runAndExport(root, out);

        assertNull(outcome.graph());
        assertEquals(TerminalStatus.FAILED, outcome.report().status());
        var event = outcome.report().events().get(0);
        assertEquals(Stage.MANIFEST, event.stage());
        assertEquals("MISSING_MANIFEST", event.code());
        assertTrue(Files.exists(out.resolve(MigrationExporter.REPORT_FILE)));
        assertFalse(Files.exists(out.resolve(MigrationExporter.GRAPH_FILE)));
    }

    @Test
    void migratesQuizzesAndAssignments() {
        CourseFixtures.write(root, "imsmanifest.xml", CourseFixtures.manifest("""
                        <item identifier="m1"><title>Assessments</title>
                          <item identifier="i1" identifierref="quiz1"><title>Quiz item</title></item>
                          <item identifier="i2" identifierref="asg1"><title>Essay item</title></item>
                          <item identifier="i3" identifierref="asg2"><title>Reflection</title></item>
                        </item>
                """, """
                    <resource identifier="quiz1" type="imsqti_xmlv1p2/imscc_xmlv1p1/assessment">
                      <file href="quiz1/assessment_qti.xml"/>
                    </resource>
                    <resource identifier="quiz1_meta" type="associatedcontent/imscc_xmlv1p1/learning-application-resource" href="quiz1/assessment_meta.xml">
                      <file href="quiz1/assessment_meta.xml"/>
                    </resource>
                    <resource identifier="asg1" type="associatedcontent/imscc_xmlv1p1/learning-application-resource" href="asg1/essay.html">
                      <file href="asg1/essay.html"/>
                      <file href="asg1/assignment_settings.xml"/>
                    </resource>
                    <resource identifier="asg2" type="associatedcontent/imscc_xmlv1p1/learning-application-resource" href="asg2/reflection.html">
                      <file href="asg2/reflection.html"/>
                    </resource>
                """));
        CourseFixtures.write(root, "quiz1/assessment_qti.xml", """
                <?xml version="1.0" encoding="UTF-8"?>
                <questestinterop xmlns="http://www.imsglobal.org/xsd/ims_qtiasiv1p2">
                  <assessment ident="quiz1" title="Quiz One">
                    <section ident="root_section">
                      <item ident="q1" title="Capital">
                        <itemmetadata><qtimetadata>
                          <qtimetadatafield><fieldlabel>question_type</fieldlabel><fieldentry>multiple_choice_question</fieldentry></qtimetadatafield>
                          <qtimetadatafield><fieldlabel>points_possible</fieldlabel><fieldentry>2.0</fieldentry></qtimetadatafield>
                        </qtimetadata></itemmetadata>
                        <presentation>
                          <material><mattext texttype="text/html">&lt;p&gt;Capital of France?&lt;/p&gt;</mattext></material>
                          <response_lid ident="response1" rcardinality="Single"><render_choice>
                            <response_label ident="a1"><material><mattext>Paris</mattext></material></response_label>
                            <response_label ident="a2"><material><mattext>Rome</mattext></material></response_label>
                          </render_choice></response_lid>
                        </presentation>
                        <resprocessing>
                          <respcondition continue="No">
                            <conditionvar><varequal respident="response1">a1</varequal></conditionvar>
                            <setvar action="Set" varname="SCORE">100</setvar>
                          </respcondition>
                        </resprocessing>
                      </item>
                      <item ident="q2" title="Compound interest">
                        <itemmetadata><qtimetadata>
                          <qtimetadatafield><fieldlabel>question_type</fieldlabel><fieldentry>calculated_question</fieldentry></qtimetadatafield>
                        </qtimetadata></itemmetadata>
                        <presentation><material><mattext>Compute the interest.</mattext></material></presentation>
                      </item>
                      <item ident="q3" title="Mystery">
                        <presentation><material><mattext>No type given.</mattext></material></presentation>
                      </item>
                    </section>
                  </assessment>
                </questestinterop>
                """);
        CourseFixtures.write(root, "quiz1/assessment_meta.xml", """
                <quiz identifier="quiz1">
                  <title>Checkpoint</title>
                  <description>&lt;p&gt;Short check&lt;/p&gt;</description>
                  <time_limit>30</time_limit>
                  <allowed_attempts>2</allowed_attempts>
                </quiz>
                """);
        CourseFixtures.write(root, "asg1/essay.html", "<html><body><p>Write an essay</p></body></html>");
        CourseFixtures.write(root, "asg1/assignment_settings.xml", """
                <assignment identifier="asg1">
                  <title>Essay</title>
                  <due_at>2024-05-01T23:59:00</due_at>
                  <points_possible>50.0</points_possible>
                </assignment>
                """);
        CourseFixtures.write(root, "asg2/reflection.html", "<html><body><p>Reflect</p></body></html>");

        var outcome = service.run(root);

        var report = outcome.report();
        assertEquals(TerminalStatus.SUCCESS_WITH_WARNINGS, report.status());
        assertEquals(0, report.count(Severity.ERROR));

        var items = outcome.graph().topics().get(0).items();
        assertEquals(List.of(0, 1, 2), items.stream().map(TopicItem::order).toList());

        var quiz = (Quiz) items.get(0);
        assertEquals("quiz:i1", quiz.id());
        assertEquals("Checkpoint", quiz.title());
        assertEquals("<p>Short check</p>", quiz.content());
        assertEquals(30, quiz.timeLimitMinutes());
        assertEquals(2, quiz.attemptsAllowed());
        assertEquals(List.of("Capital", "Compound interest", "Mystery"), quiz.questions().stream().map(Question::title).toList());

        var capital = quiz.questions().get(0);
        assertEquals(TargetQuestionKind.MULTIPLE_CHOICE, capital.kind());
        assertEquals(MappingConfidence.DIRECT, capital.confidence());
        assertEquals(2.0, capital.mark());
        assertEquals("<p>Capital of France?</p>", capital.content());
        assertEquals(List.of("Paris", "Rome"), capital.answers().stream().map(Answer::content).toList());
        assertTrue(capital.answers().get(0).correct());
        assertFalse(capital.answers().get(1).correct());

        var calculated = quiz.questions().get(1);
        assertEquals(TargetQuestionKind.OPEN_ENDED, calculated.kind());
        assertEquals(MappingConfidence.FALLBACK_REQUIRES_REVIEW, calculated.confidence());
        assertEquals("unknown", quiz.questions().get(2).sourceKind());

        var fallbacks = report.eventsWithCode("QUESTION_KIND_FALLBACK");
        assertEquals(List.of(calculated.id(), quiz.questions().get(2).id()), fallbacks.stream().map(ReportEvent::entityId).toList());
        assertEquals(1, report.counter("questionKind.multiple_choice_question"));
        assertEquals(1, report.counter("questionKind.calculated_question"));
        assertEquals(1, report.counter("questionKind.unknown"));
        assertEquals(3, report.counter("questions"));

        var essay = (Assignment) items.get(1);
        assertEquals("Essay", essay.title());
        assertEquals("<p>Write an essay</p>", essay.content());
        assertEquals("2024-05-01T23:59:00", essay.dueAt());
        assertEquals(50.0, essay.totalPoints());
        assertEquals(30.0, essay.passPoints(), 1e-9);
        assertFalse(essay.metadataDefaulted());

        var reflection = (Assignment) items.get(2);
        assertEquals("Reflection", reflection.title());
        assertTrue(reflection.metadataDefaulted());
        assertEquals(0.0, reflection.totalPoints());
        assertEquals(reflection.id(), report.eventsWithCode("ASSIGNMENT_METADATA_DEFAULTED").get(0).entityId());
    }

    @Test
    void keepsOrderAndReportsEveryItemItCannotMigrate() {
        CourseFixtures.write(root, "imsmanifest.xml", CourseFixtures.manifest("""
                        <item identifier="m1"><title>First</title>
                          <item identifier="a" identifierref="pageA"><title>Page A</title></item>
                          <item identifier="s1"><title>Sub header</title>
                            <item identifier="b" identifierref="pageB"><title>Page B</title></item>
                          </item>
                          <item identifier="t1"><title>Read carefully</title></item>
                          <item identifier="w" identifierref="link1"><title>External</title></item>
                          <item identifier="d" identifierref="pageD"><title>Gone</title></item>
                          <item identifier="x" identifierref="pageX"><title>Broken</title></item>
                        </item>
                        <item identifier="m2"><title>Second</title>
                          <item identifier="c" identifierref="pageC"/>
                        </item>
                """, """
                    <resource identifier="pageA" type="webcontent" href="wiki_content/a.html"/>
                    <resource identifier="pageB" type="webcontent" href="wiki_content/b.html"/>
                    <resource identifier="pageC" type="webcontent" href="wiki_content/week_two-overview.html"/>
                    <resource identifier="pageD" type="webcontent" href="wiki_content/d.html"/>
                    <resource identifier="pageX" type="webcontent" href="wiki_content/x.xml"/>
                    <resource identifier="link1" type="imswl_xmlv1p1" href="link1.xml"/>
                """));
        CourseFixtures.write(root, "wiki_content/a.html", "<html><body><p>A</p></body></html>");
        CourseFixtures.write(root, "wiki_content/b.html", "<html><body><p>B</p></body></html>");
        CourseFixtures.write(root, "wiki_content/week_two-overview.html", "<html><body><p>C</p></body></html>");
        CourseFixtures.write(root, "wiki_content/x.xml", "<page><title>Broken</page>");
        CourseFixtures.write(root, "link1.xml", "<webLink><url href=\"https://example.com\"/></webLink>");

        var outcome = service.run(root);

        var report = outcome.report();
        assertEquals(TerminalStatus.SUCCESS_WITH_WARNINGS, report.status());
        var topics = outcome.graph().topics();
        assertEquals(List.of("First", "Second"), topics.stream().map(Topic::title).toList());
        assertEquals(List.of(0, 1), topics.stream().map(Topic::order).toList());
        assertEquals(List.of("Page A", "Page B"), topics.get(0).items().stream().map(TopicItem::title).toList());
        assertEquals(List.of("Week Two Overview"), topics.get(1).items().stream().map(TopicItem::title).toList());

        assertEquals("s1", report.eventsWithCode("FLATTENED_SUBHEADER").get(0).entityId());
        assertEquals("t1", report.eventsWithCode("TEXT_HEADER").get(0).entityId());
        assertEquals("w", report.eventsWithCode("UNSUPPORTED_ITEM").get(0).entityId());
        assertEquals("pageD", report.eventsWithCode("MISSING_CONTENT_FILE").get(0).entityId());
        assertEquals("pageX", report.eventsWithCode("CONTENT_PARSE_ERROR").get(0).entityId());
        assertTrue(report.eventsWithCode("CONTENT_UNACCOUNTED").isEmpty());
        assertTrue(report.eventsWithCode("LESSON_COUNT_MISMATCH").isEmpty());
    }

    @Test
    void storesRunHistory() {
        CourseFixtures.welcomeCourse(root);

        var outcome = service.run(root);
        var stored = service.findRun(outcome.runId()).orElseThrow();

        assertEquals(outcome.report().status(), stored.run().status());
        assertEquals("course_1", stored.run().courseId());
        assertEquals(outcome.report().events(), stored.events());
        assertEquals(outcome.report().counters(), stored.run().counters());
        assertTrue(service.findRun("no-such-run").isEmpty());
    }

    private static List<String> codes(List<ReportEvent> events) {
        return events.stream().map(e -> e.stage() + ":" + e.code() + ":" + e.entityId()).toList();
    }
}
