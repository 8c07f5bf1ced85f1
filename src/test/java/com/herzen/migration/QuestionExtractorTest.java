package com.herzen.migration;

import com.herzen.migration.config.MigrationProperties;
import com.herzen.migration.extract.HtmlCleaner;
import com.herzen.migration.extract.QuestionExtractor;
import com.herzen.migration.extract.XmlMarkupDocument;
import com.herzen.migration.extract.XmlSupport;
import com.herzen.migration.extract.ExtractionModels.ChoiceFields;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionExtractorTest {
    private final HtmlCleaner cleaner = new HtmlCleaner(MigrationProperties.defaults());
    private final QuestionExtractor extractor = new QuestionExtractor(cleaner);

    @Test
    void readsQti12ItemsInDocumentOrder() throws Exception {
        String qti = """
                <questestinterop xmlns="http://www.imsglobal.org/xsd/ims_qtiasiv1p2">
                  <assessment ident="quiz1" title="Quiz One">
                    <section ident="root_section">
                      <item ident="q2" title="Primes">
                        <itemmetadata><qtimetadata>
                          <qtimetadatafield><fieldlabel>question_type</fieldlabel><fieldentry>multiple_answers_question</fieldentry></qtimetadatafield>
                          <qtimetadatafield><fieldlabel>points_possible</fieldlabel><fieldentry>3.0</fieldentry></qtimetadatafield>
                        </qtimetadata></itemmetadata>
                        <presentation>
                          <material><mattext texttype="text/html">&lt;p&gt;Which are prime?&lt;/p&gt;</mattext></material>
                          <response_lid ident="response1" rcardinality="Multiple"><render_choice>
                            <response_label ident="a1"><material><mattext>2</mattext></material></response_label>
                            <response_label ident="a2"><material><mattext>4</mattext></material></response_label>
                            <response_label ident="a3"><material><mattext>5</mattext></material></response_label>
                          </render_choice></response_lid>
                        </presentation>
                        <resprocessing>
                          <respcondition continue="No">
                            <conditionvar><and>
                              <varequal respident="response1">a1</varequal>
                              <not><varequal respident="response1">a2</varequal></not>
                              <varequal respident="response1">a3</varequal>
                            </and></conditionvar>
                            <setvar varname="SCORE" action="Set">100</setvar>
                          </respcondition>
                        </resprocessing>
                      </item>
                      <item ident="q1" title="Essay">
                        <itemmetadata><qtimetadata>
                          <qtimetadatafield><fieldlabel>question_type</fieldlabel><fieldentry>essay_question</fieldentry></qtimetadatafield>
                        </qtimetadata></itemmetadata>
                        <presentation><material><mattext>Explain recursion.</mattext></material></presentation>
                      </item>
                    </section>
                  </assessment>
                </questestinterop>
                """;
        var questions = extractor.extract(new XmlMarkupDocument(XmlSupport.read(qti)));

        assertEquals(List.of("q2", "q1"), questions.stream().map(q -> q.identifier()).toList());
        var primes = questions.get(0);
        assertEquals("multiple_answers_question", primes.kindLabel());
        assertEquals(3.0, primes.points());
        assertEquals("<p>Which are prime?</p>", primes.text());
        assertEquals(List.of("2", "4", "5"), primes.choices().stream().map(ChoiceFields::text).toList());
        assertEquals(List.of(true, false, true), primes.choices().stream().map(ChoiceFields::correct).toList());

        var essay = questions.get(1);
        assertEquals("essay_question", essay.kindLabel());
        assertEquals(1.0, essay.points());
        assertEquals("Explain recursion.", essay.text());
        assertTrue(essay.choices().isEmpty());
    }

    @Test
    void readsQti2ChoiceItem() throws Exception {
        String qti = """
                <assessmentItem xmlns="http://www.imsglobal.org/xsd/imsqti_v2p1" identifier="colors" title="Colors">
                  <responseDeclaration identifier="RESPONSE" cardinality="multiple" baseType="identifier">
                    <correctResponse><value>A</value><value>C</value></correctResponse>
                  </responseDeclaration>
                  <itemBody>
                    <p>Pick the primary colors</p>
                    <choiceInteraction responseIdentifier="RESPONSE" maxChoices="0">
                      <simpleChoice identifier="A">Red</simpleChoice>
                      <simpleChoice identifier="B">Green</simpleChoice>
                      <simpleChoice identifier="C">Blue</simpleChoice>
                    </choiceInteraction>
                  </itemBody>
                </assessmentItem>
                """;
        var questions = extractor.extract(new XmlMarkupDocument(XmlSupport.read(qti)));

        assertEquals(1, questions.size());
        var question = questions.get(0);
        assertEquals("colors", question.identifier());
        assertEquals("Colors", question.title());
        assertEquals("multiple_answers_question", question.kindLabel());
        assertTrue(cleaner.plainText(question.text()).contains("Pick the primary colors"));
        assertFalse(question.text().contains("Red"));
        assertEquals(List.of("Red", "Green", "Blue"), question.choices().stream().map(ChoiceFields::text).toList());
        assertEquals(List.of(true, false, true), question.choices().stream().map(ChoiceFields::correct).toList());
    }
}
