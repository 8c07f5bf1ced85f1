package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import org.jsoup.nodes.Entities;

import java.util.Set;
import java.util.stream.Collectors;

public class TextRunExtractor implements FieldExtractor {
    private final Set<String> skippedElements;

    public TextRunExtractor(Set<String> skippedElements) {
        this.skippedElements = skippedElements;
    }

    @Override
    public ExtractedFields extract(MarkupDocument document) {
        String body = document.textRuns(skippedElements).stream()
                .map(run -> "<p>" + Entities.escape(run) + "</p>")
                .collect(Collectors.joining());
        return new ExtractedFields(null, body, null, true);
    }
}
