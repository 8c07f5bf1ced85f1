package com.herzen.migration.extract;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface MarkupDocument {
    Optional<String> firstContent(String localName);

    List<String> textRuns(Set<String> skippedElements);
}
