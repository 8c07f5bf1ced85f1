package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ChoiceFields;
import com.herzen.migration.extract.ExtractionModels.QuestionFields;
import org.dom4j.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class QuestionExtractor {
    private static final Logger log = LoggerFactory.getLogger(QuestionExtractor.class);

    private static final Set<String> ITEM_TAGS = Set.of("item", "assessmentitem");

    private final HtmlCleaner cleaner;

    public QuestionExtractor(HtmlCleaner cleaner) {
        this.cleaner = cleaner;
    }

    public List<QuestionFields> extract(XmlMarkupDocument document) {
        Element root = document.root();
        List<Element> items = new ArrayList<>();
        if (ITEM_TAGS.contains(root.getName().toLowerCase())) items.add(root);
        items.addAll(XmlSupport.descendants(root, ITEM_TAGS));

        List<QuestionFields> questions = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            questions.add(question(items.get(i), i));
        }
        return questions;
    }

    private QuestionFields question(Element item, int position) {
        String id = Optional.ofNullable(XmlSupport.attribute(item, "ident"))
                .or(() -> Optional.ofNullable(XmlSupport.attribute(item, "identifier")))
                .orElse("item-" + position);
        String title = Optional.ofNullable(XmlSupport.attribute(item, "title"))
                .orElseGet(() -> XmlSupport.firstDescendant(item, "title").map(XmlSupport::text).filter(t -> !t.isBlank()).orElse("Question"));

        Map<String, String> metadata = metadataFields(item);
        String kind = kindLabel(item, metadata);
        double points = points(item, metadata);
        String text = cleaner.clean(questionText(item));
        List<ChoiceFields> choices = choices(item);
        return new QuestionFields(id, title, text, kind, points, choices);
    }

    private Map<String, String> metadataFields(Element item) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element field : XmlSupport.descendants(item, "qtimetadatafield")) {
            String label = XmlSupport.childText(field, "fieldlabel");
            if (!label.isEmpty()) fields.putIfAbsent(label, XmlSupport.childText(field, "fieldentry"));
        }
        return fields;
    }

    private String kindLabel(Element item, Map<String, String> metadata) {
        String label = metadata.get("question_type");
        if (label == null || label.isBlank()) label = XmlSupport.childText(item, "question_type");
        if (!label.isBlank()) return label.trim().toLowerCase(Locale.ROOT);

        Optional<Element> declaration = XmlSupport.firstDescendant(item, "responseDeclaration");
        if (declaration.isPresent()) {
            String cardinality = Optional.ofNullable(XmlSupport.attribute(declaration.get(), "cardinality")).orElse("single");
            return "multiple".equals(cardinality) ? "multiple_answers_question" : "multiple_choice_question";
        }
        return "";
    }

    private double points(Element item, Map<String, String> metadata) {
        List<String> candidates = new ArrayList<>();
        candidates.add(metadata.get("points_possible"));
        candidates.add(XmlSupport.childText(item, "points_possible"));
        candidates.add(XmlSupport.childText(item, "maxScore"));
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) continue;
            try {
                return Double.parseDouble(candidate.trim());
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric question points '{}'", candidate);
            }
        }
        return 1.0;
    }

    private String questionText(Element item) {
        Optional<Element> presentation = XmlSupport.firstDescendant(item, "presentation");
        if (presentation.isPresent()) {
            Optional<Element> material = presentation.get().elements("material").stream().findFirst()
                    .or(() -> XmlSupport.firstDescendant(presentation.get(), "material"));
            if (material.isPresent()) return materialText(material.get());
        }
        Optional<Element> itemBody = XmlSupport.firstDescendant(item, "itemBody");
        if (itemBody.isPresent()) {
            Element copy = itemBody.get().createCopy();
            XmlSupport.descendants(copy, "simpleChoice").forEach(Element::detach);
            return XmlSupport.innerContent(copy);
        }
        return XmlSupport.childText(item, "question_text");
    }

    private String materialText(Element material) {
        return XmlSupport.firstDescendant(material, "mattext")
                .map(XmlSupport::innerContent)
                .orElseGet(() -> XmlSupport.innerContent(material));
    }

    private List<ChoiceFields> choices(Element item) {
        List<ChoiceFields> choices = new ArrayList<>();
        List<Element> labels = XmlSupport.descendants(item, "response_label");
        if (!labels.isEmpty()) {
            Set<String> correct = qti1CorrectIdents(item);
            for (Element label : labels) {
                String ident = Optional.ofNullable(XmlSupport.attribute(label, "ident")).orElse("");
                String text = XmlSupport.firstDescendant(label, "material").map(this::materialText).orElseGet(() -> XmlSupport.innerContent(label));
                choices.add(new ChoiceFields(ident, cleaner.clean(text), correct.contains(ident)));
            }
            return choices;
        }

        Set<String> correct = new HashSet<>();
        XmlSupport.firstDescendant(item, "correctResponse")
                .ifPresent(r -> XmlSupport.descendants(r, "value").forEach(v -> correct.add(XmlSupport.text(v))));
        for (Element choice : XmlSupport.descendants(item, "simpleChoice")) {
            String ident = Optional.ofNullable(XmlSupport.attribute(choice, "identifier")).orElse("");
            choices.add(new ChoiceFields(ident, cleaner.clean(XmlSupport.innerContent(choice)), correct.contains(ident)));
        }
        return choices;
    }

    private Set<String> qti1CorrectIdents(Element item) {
        Set<String> correct = new HashSet<>();
        for (Element condition : XmlSupport.descendants(item, "respcondition")) {
            boolean scores = XmlSupport.descendants(condition, "setvar").stream().anyMatch(this::positive);
            if (!scores) continue;
            Element conditionVar = condition.element("conditionvar");
            if (conditionVar == null) continue;
            for (Element equal : XmlSupport.descendants(conditionVar, "varequal")) {
                if (!underNot(equal, conditionVar)) correct.add(XmlSupport.text(equal));
            }
        }
        return correct;
    }

    private boolean positive(Element setvar) {
        try {
            return Double.parseDouble(XmlSupport.text(setvar)) > 0;
        } catch (NumberFormatException e) {
            log.debug("Treating non-numeric score '{}' as not scoring", XmlSupport.text(setvar));
            return false;
        }
    }

    private boolean underNot(Element element, Element stop) {
        for (Element parent = element.getParent(); parent != null && parent != stop; parent = parent.getParent()) {
            if ("not".equals(parent.getName())) return true;
        }
        return false;
    }
}
