package com.herzen.migration.transform;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Component
public class MappingRules {
    public record MappingRule(TargetQuestionKind target, MappingConfidence confidence) {
        public boolean fallback() {
            return confidence == MappingConfidence.FALLBACK_REQUIRES_REVIEW;
        }
    }

    public static final MappingRule DEFAULT = new MappingRule(TargetQuestionKind.OPEN_ENDED, MappingConfidence.FALLBACK_REQUIRES_REVIEW);

    private final Map<SourceQuestionKind, MappingRule> rules;

    public MappingRules() {
        Map<SourceQuestionKind, MappingRule> map = new EnumMap<>(SourceQuestionKind.class);
        map.put(SourceQuestionKind.MULTIPLE_CHOICE, direct(TargetQuestionKind.MULTIPLE_CHOICE));
        map.put(SourceQuestionKind.TRUE_FALSE, direct(TargetQuestionKind.TRUE_FALSE));
        map.put(SourceQuestionKind.ESSAY, direct(TargetQuestionKind.OPEN_ENDED));
        map.put(SourceQuestionKind.SHORT_ANSWER, direct(TargetQuestionKind.SHORT_ANSWER));
        map.put(SourceQuestionKind.FILL_IN_MULTIPLE_BLANKS, direct(TargetQuestionKind.FILL_IN_THE_BLANK));
        map.put(SourceQuestionKind.MATCHING, direct(TargetQuestionKind.MATCHING));
        map.put(SourceQuestionKind.NUMERICAL, fallback(TargetQuestionKind.SHORT_ANSWER));
        map.put(SourceQuestionKind.CALCULATED, fallback(TargetQuestionKind.OPEN_ENDED));
        map.put(SourceQuestionKind.MULTIPLE_ANSWERS, direct(TargetQuestionKind.MULTIPLE_CHOICE));
        map.put(SourceQuestionKind.FILE_UPLOAD, fallback(TargetQuestionKind.OPEN_ENDED));
        map.put(SourceQuestionKind.TEXT_ONLY, fallback(TargetQuestionKind.OPEN_ENDED));
        map.put(SourceQuestionKind.MULTIPLE_DROPDOWNS, fallback(TargetQuestionKind.MULTIPLE_CHOICE));
        map.put(SourceQuestionKind.FORMULA, fallback(TargetQuestionKind.OPEN_ENDED));
        map.put(SourceQuestionKind.CATEGORIZATION, fallback(TargetQuestionKind.MATCHING));
        map.put(SourceQuestionKind.ORDERING, direct(TargetQuestionKind.ORDERING));
        for (SourceQuestionKind kind : SourceQuestionKind.values()) {
            if (!map.containsKey(kind)) throw new IllegalStateException("No mapping rule for " + kind.label());
        }
        this.rules = Collections.unmodifiableMap(map);
    }

    public MappingRule rule(SourceQuestionKind kind) {
        return rules.get(kind);
    }

    public MappingRule rule(String sourceLabel) {
        return SourceQuestionKind.fromLabel(sourceLabel).map(rules::get).orElse(DEFAULT);
    }

    public Map<SourceQuestionKind, MappingRule> rules() {
        return rules;
    }

    private static MappingRule direct(TargetQuestionKind target) {
        return new MappingRule(target, MappingConfidence.DIRECT);
    }

    private static MappingRule fallback(TargetQuestionKind target) {
        return new MappingRule(target, MappingConfidence.FALLBACK_REQUIRES_REVIEW);
    }
}
