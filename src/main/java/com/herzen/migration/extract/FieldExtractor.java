package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ExtractedFields;

public interface FieldExtractor {
    ExtractedFields extract(MarkupDocument document);
}
