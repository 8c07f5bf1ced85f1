package com.herzen.migration.extract;

import java.util.List;

public class ExtractionModels {
    public record FieldCandidates(List<String> title, List<String> body, List<String> notes) {}

    public record ExtractedFields(String title, String body, String notes, boolean fallbackUsed) {
        public boolean hasBody() {
            return body != null && !body.isBlank();
        }
    }

    public record ChoiceFields(String identifier, String text, boolean correct) {}

    public record QuestionFields(String identifier, String title, String text, String kindLabel,
                                 double points, List<ChoiceFields> choices) {}
}
