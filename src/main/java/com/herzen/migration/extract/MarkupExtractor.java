package com.herzen.migration.extract;

import com.herzen.migration.extract.ExtractionModels.ExtractedFields;
import org.dom4j.DocumentException;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

@Component
public class MarkupExtractor {
    private final HtmlCleaner cleaner;
    private final Map<ContentKind, FieldExtractor> variants = new EnumMap<>(ContentKind.class);

    public MarkupExtractor(HtmlCleaner cleaner) {
        this.cleaner = cleaner;
        for (ContentKind kind : ContentKind.values()) {
            variants.put(kind, new TaggedFieldExtractor(kind.candidates()));
        }
    }

    public ExtractedFields extract(String markup, MarkupFormat format, ContentKind kind) throws MarkupParseException {
        return extract(parse(markup, format), kind);
    }

    public ExtractedFields extract(MarkupDocument document, ContentKind kind) {
        ExtractedFields raw = variants.get(kind).extract(document);
        boolean fallback = false;
        String body = raw.body();
        if (kind.fallbackOnMissingBody() && (body == null || (cleaner.plainText(body).isEmpty() && !hasEmbeddedMedia(body)))) {
            Set<String> skipped = new HashSet<>(kind.candidates().notes());
            if (raw.title() != null) skipped.addAll(kind.candidates().title());
            body = new TextRunExtractor(skipped).extract(document).body();
            fallback = true;
        }
        String title = raw.title() == null ? null : cleaner.plainText(raw.title());
        return new ExtractedFields(
                title == null || title.isEmpty() ? null : title,
                cleaner.clean(body),
                raw.notes() == null ? null : cleaner.clean(raw.notes()),
                fallback);
    }

    public MarkupDocument parse(String markup, MarkupFormat format) throws MarkupParseException {
        String source = markup == null ? "" : markup;
        if (format == MarkupFormat.MARKUP) return new HtmlMarkupDocument(Jsoup.parse(source));
        try {
            return new XmlMarkupDocument(XmlSupport.read(source));
        } catch (DocumentException e) {
            throw new MarkupParseException("Document is not well-formed: " + e.getMessage(), e);
        }
    }

    private boolean hasEmbeddedMedia(String html) {
        return !Jsoup.parseBodyFragment(html).select("img, video, audio, iframe, object, embed").isEmpty();
    }
}
