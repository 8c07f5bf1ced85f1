package com.herzen.migration.transform;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetQuestionKind {
    MULTIPLE_CHOICE,
    SINGLE_CHOICE,
    TRUE_FALSE,
    FILL_IN_THE_BLANK,
    OPEN_ENDED,
    SHORT_ANSWER,
    MATCHING,
    IMAGE_MATCHING,
    IMAGE_ANSWERING,
    ORDERING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
