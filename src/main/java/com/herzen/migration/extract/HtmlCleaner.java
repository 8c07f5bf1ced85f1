package com.herzen.migration.extract;

import com.herzen.migration.config.MigrationProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class HtmlCleaner {
    public static final Pattern FILE_BASE_PLACEHOLDER = Pattern.compile("(?:\\$IMS-CC-FILEBASE\\$|%24IMS-CC-FILEBASE%24)/");

    private final MigrationProperties properties;

    public HtmlCleaner(MigrationProperties properties) {
        this.properties = properties;
    }

    /**
     * Named entities become characters and markup-significant characters stay escaped.
     * Running it twice changes nothing.
     */
    public String clean(String html) {
        if (html == null || html.isBlank()) return "";
        Document fragment = Jsoup.parseBodyFragment(html);
        fragment.outputSettings()
                .prettyPrint(false)
                .charset(StandardCharsets.UTF_8)
                .escapeMode(Entities.EscapeMode.xhtml);
        fragment.body().select("[xmlns]").removeAttr("xmlns");
        return rewriteAssetPlaceholders(fragment.body().html().trim());
    }

    public String rewriteAssetPlaceholders(String html) {
        if (html == null || html.isEmpty()) return html == null ? "" : html;
        return FILE_BASE_PLACEHOLDER.matcher(html).replaceAll(Matcher.quoteReplacement(properties.assetTargetPrefix()));
    }

    public String plainText(String html) {
        if (html == null || html.isBlank()) return "";
        return Jsoup.parseBodyFragment(html).text().trim();
    }
}
