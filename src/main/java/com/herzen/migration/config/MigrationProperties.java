package com.herzen.migration.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "migration")
public record MigrationProperties(
        @DefaultValue("imsmanifest.xml") String manifestFile,
        @DefaultValue("tutor_lms_output") String outputDirectory,
        @DefaultValue({".git", "course_settings"}) List<String> ignoredDirectories,
        @DefaultValue({"imsmanifest.xml", "course_settings.xml", "module_meta.xml", "assignment_settings.xml",
                "files_meta.xml", "context.xml", "syllabus.html"}) List<String> systemFiles,
        @DefaultValue("xml") List<String> structuredExtensions,
        @DefaultValue({"html", "htm"}) List<String> markupExtensions,
        @DefaultValue("pptx") List<String> presentationExtensions,
        @DefaultValue("web_resources") String assetSourceDirectory,
        @DefaultValue("../../assets/") String assetTargetPrefix,
        @DefaultValue("Recovered Content") String recoveredModuleTitle,
        @DefaultValue("true") boolean persistRuns) {

    public static MigrationProperties defaults() {
        return new MigrationProperties(
                "imsmanifest.xml",
                "tutor_lms_output",
                List.of(".git", "course_settings"),
                List.of("imsmanifest.xml", "course_settings.xml", "module_meta.xml", "assignment_settings.xml",
                        "files_meta.xml", "context.xml", "syllabus.html"),
                List.of("xml"),
                List.of("html", "htm"),
                List.of("pptx"),
                "web_resources",
                "../../assets/",
                "Recovered Content",
                false);
    }

    public boolean isSystemFile(String fileName) {
        return systemFiles.stream().anyMatch(f -> f.equalsIgnoreCase(fileName));
    }

    public boolean isStructured(String path) {
        return structuredExtensions.contains(extension(path));
    }

    public boolean isMarkup(String path) {
        return markupExtensions.contains(extension(path));
    }

    public boolean isPresentation(String path) {
        return presentationExtensions.contains(extension(path));
    }

    public boolean isRecognizedContent(String path) {
        return isStructured(path) || isMarkup(path) || isPresentation(path);
    }

    public static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
