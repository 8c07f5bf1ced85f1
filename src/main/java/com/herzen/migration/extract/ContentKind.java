package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.FieldCandidates;

import java.util.List;

public enum ContentKind {
    PAGE(new FieldCandidates(List.of("title"), List.of("body", "text", "content"), List.of("notes")), true),
    ASSIGNMENT(new FieldCandidates(List.of("title"), List.of("body", "description", "text"), List.of("notes")), true),
    ASSIGNMENT_SETTINGS(new FieldCandidates(List.of("title"), List.of("description"), List.of()), false),
    QUIZ(new FieldCandidates(List.of("title"), List.of("description", "rubric", "qticomment"), List.of()), false),
    RECOVERED(new FieldCandidates(
            List.of("title", "h1", "heading", "name", "slide-title", "presentation-title"),
            List.of("body", "content", "text", "description", "slide-content"),
            List.of("notes", "speaker-notes")), true);

    private final FieldCandidates candidates;
    private final boolean fallbackOnMissingBody;

    ContentKind(FieldCandidates candidates, boolean fallbackOnMissingBody) {
        this.candidates = candidates;
        this.fallbackOnMissingBody = fallbackOnMissingBody;
    }

    public FieldCandidates candidates() {
        return candidates;
    }

    public boolean fallbackOnMissingBody() {
        return fallbackOnMissingBody;
    }
}
