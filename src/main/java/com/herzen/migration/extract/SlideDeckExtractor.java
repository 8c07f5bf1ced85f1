package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.*;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class SlideDeckExtractor {
    private static final Logger log = LoggerFactory.getLogger(SlideDeckExtractor.class);
    private static final Set<Placeholder> SKIPPED_PLACEHOLDERS = EnumSet.of(Placeholder.TITLE, Placeholder.CENTERED_TITLE,
            Placeholder.DATETIME, Placeholder.FOOTER, Placeholder.SLIDE_NUMBER, Placeholder.HEADER);

    private final HtmlCleaner cleaner;

    public SlideDeckExtractor(HtmlCleaner cleaner) {
        this.cleaner = cleaner;
    }

    public ExtractedFields extract(byte[] deck) throws MarkupParseException {
        try (XMLSlideShow show = new XMLSlideShow(new ByteArrayInputStream(deck))) {
            Document document = Document.createShell("");
            document.outputSettings().prettyPrint(false);
            Element container = document.body().appendElement("div").addClass("slide-deck");
            Element notes = document.body().appendElement("div");

            List<XSLFSlide> slides = show.getSlides();
            for (int i = 0; i < slides.size(); i++) {
                XSLFSlide slide = slides.get(i);
                Element section = container.appendElement("div").addClass("slide").attr("id", "slide-" + (i + 1));
                String title = slide.getTitle();
                if (title != null && !title.isBlank()) section.appendElement("h2").text(title.trim());

                List<String> texts = new ArrayList<>();
                collectText(slide.getShapes(), texts);
                texts.forEach(text -> appendText(section, text));

                String speakerNotes = speakerNotes(slide);
                if (!speakerNotes.isEmpty()) notes.appendElement("p").text("Slide " + (i + 1) + ": " + speakerNotes);
            }
            log.debug("Read slide deck with {} slides", slides.size());
            String notesHtml = notes.children().isEmpty() ? null : cleaner.clean(notes.html());
            String body = container.text().isBlank() ? "" : cleaner.clean(container.outerHtml());
            return new ExtractedFields(null, body, notesHtml, false);
        } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
            throw new MarkupParseException("Slide deck cannot be read: " + e.getMessage(), e);
        }
    }

    private void collectText(List<XSLFShape> shapes, List<String> texts) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFGroupShape group) {
                collectText(group.getShapes(), texts);
            } else if (shape instanceof XSLFTextShape text && !SKIPPED_PLACEHOLDERS.contains(text.getTextType())) {
                String value = text.getText();
                if (value != null && !value.isBlank()) texts.add(value);
            }
        }
    }

    private void appendText(Element section, String text) {
        List<String> lines = text.lines().map(String::trim).filter(line -> !line.isEmpty()).toList();
        if (lines.size() == 1) {
            section.appendElement("p").text(lines.get(0));
            return;
        }
        Element list = section.appendElement("ul");
        lines.forEach(line -> list.appendElement("li").text(line));
    }

    private String speakerNotes(XSLFSlide slide) {
        XSLFNotes notes = slide.getNotes();
        if (notes == null) return "";
        List<String> parts = new ArrayList<>();
        for (XSLFShape shape : notes.getShapes()) {
            if (shape instanceof XSLFTextShape text && text.getTextType() == Placeholder.BODY) {
                String value = text.getText();
                if (value != null && !value.isBlank()) parts.add(value.trim());
            }
        }
        return String.join(" ", parts);
    }
}
