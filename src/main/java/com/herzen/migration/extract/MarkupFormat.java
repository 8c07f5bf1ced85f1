package com.herzen.migration.extract;

import com.herzen.migration.config.MigrationProperties;

public enum MarkupFormat {
    STRUCTURED,
    MARKUP;

    public static MarkupFormat of(String path, MigrationProperties properties) {
        return properties.isMarkup(path) ? MARKUP : STRUCTURED;
    }
}
