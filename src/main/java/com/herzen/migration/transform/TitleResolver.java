package com.herzen.migration.transform;

import com.herzen.migration.config.MigrationProperties;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public final class TitleResolver {
    private TitleResolver() {
    }

    /** Content title, then node title, then the humanized file name, then {@code fallback}. */
    public static String resolve(String contentTitle, String nodeTitle, String sourcePath, String fallback) {
        if (contentTitle != null && !contentTitle.isBlank()) return contentTitle.trim();
        if (nodeTitle != null && !nodeTitle.isBlank()) return nodeTitle.trim();
        String humanized = humanize(sourcePath);
        return humanized.isEmpty() ? fallback : humanized;
    }

    public static String humanize(String path) {
        if (path == null || path.isBlank()) return "";
        String name = MigrationProperties.fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        return Arrays.stream(name.split("[_\\-\\s]+"))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1))
                .collect(Collectors.joining(" "));
    }
}
