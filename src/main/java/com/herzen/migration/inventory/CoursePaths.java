package com.herzen.migration.inventory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.UUID;
import java.util.regex.Pattern;

public final class CoursePaths {
    private static final Pattern MALFORMED_ESCAPE = Pattern.compile("%(?![0-9A-Fa-f]{2})");

    private CoursePaths() {
    }

    public static String normalize(String href) {
        if (href == null || href.isBlank()) return null;
        String path = href.trim().replace('\\', '/');
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) path = path.substring(0, cut);
        if (path.contains("%") && !MALFORMED_ESCAPE.matcher(path).find()) {
            path = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
        }
        while (path.startsWith("./")) path = path.substring(2);
        while (path.startsWith("/")) path = path.substring(1);
        return path.isEmpty() ? null : path;
    }

    public static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    public static String parent(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public static String sibling(String path, String fileName) {
        String dir = parent(path);
        return dir.isEmpty() ? fileName : dir + "/" + fileName;
    }

    public static String recoveredId(String relativePath) {
        return "recovered_" + UUID.nameUUIDFromBytes(relativePath.getBytes(StandardCharsets.UTF_8));
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
