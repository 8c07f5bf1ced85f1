package com.herzen.migration.transform;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SourceQuestionKind {
    MULTIPLE_CHOICE,
    TRUE_FALSE,
    ESSAY,
    SHORT_ANSWER,
    FILL_IN_MULTIPLE_BLANKS,
    MATCHING,
    NUMERICAL,
    CALCULATED,
    MULTIPLE_ANSWERS,
    FILE_UPLOAD,
    TEXT_ONLY,
    MULTIPLE_DROPDOWNS,
    FORMULA,
    CATEGORIZATION,
    ORDERING;

    public String label() {
        return name().toLowerCase(Locale.ROOT) + "_question";
    }

    public static Optional<SourceQuestionKind> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.label().equals(normalized)).findFirst();
    }
}
