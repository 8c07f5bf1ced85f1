package com.herzen.migration.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class HtmlMarkupDocument implements MarkupDocument {
    private static final Set<String> NON_VISIBLE = Set.of("script", "style", "head");

    private final Document document;

    public HtmlMarkupDocument(Document document) {
        this.document = document;
        this.document.outputSettings().prettyPrint(false);
    }

    @Override
    public Optional<String> firstContent(String localName) {
        for (Element element : document.getElementsByTag(localName)) {
            String content = "title".equalsIgnoreCase(localName) ? element.text() : element.html();
            if (!content.isBlank()) return Optional.of(content);
        }
        return Optional.empty();
    }

    @Override
    public List<String> textRuns(Set<String> skippedElements) {
        List<String> runs = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text && !insideSkipped(text, skippedElements)) {
                    String value = text.text().replaceAll("\\s+", " ").trim();
                    if (!value.isEmpty()) runs.add(value);
                }
            }
        }, document);
        return runs;
    }

    private boolean insideSkipped(Node node, Set<String> skipped) {
        for (Node parent = node.parentNode(); parent != null; parent = parent.parentNode()) {
            if (parent instanceof Element element) {
                String tag = element.normalName();
                if (NON_VISIBLE.contains(tag) || skipped.contains(tag)) return true;
            }
        }
        return false;
    }
}
