package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import com.herzen.migration.extract.ExtractionModels.FieldCandidates;

import java.util.List;
import java.util.Optional;

public class TaggedFieldExtractor implements FieldExtractor {
    private final FieldCandidates candidates;

    public TaggedFieldExtractor(FieldCandidates candidates) {
        this.candidates = candidates;
    }

    @Override
    public ExtractedFields extract(MarkupDocument document) {
        return new ExtractedFields(
                first(document, candidates.title()).orElse(null),
                first(document, candidates.body()).orElse(null),
                first(document, candidates.notes()).orElse(null),
                false);
    }

    private Optional<String> first(MarkupDocument document, List<String> names) {
        for (String name : names) {
            Optional<String> content = document.firstContent(name);
            if (content.isPresent()) return content;
        }
        return Optional.empty();
    }
}
