package com.herzen.migration.extract;

import org.dom4j.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class XmlMarkupDocument implements MarkupDocument {
    private final Document document;

    public XmlMarkupDocument(Document document) {
        this.document = document;
    }

    public Element root() {
        return document.getRootElement();
    }

    @Override
    public Optional<String> firstContent(String localName) {
        return XmlSupport.descendants(root(), localName).stream()
                .map(XmlSupport::innerContent)
                .filter(c -> c != null && !c.isBlank())
                .findFirst()
                .or(() -> localName.equalsIgnoreCase(root().getName())
                        ? Optional.of(XmlSupport.innerContent(root())).filter(c -> !c.isBlank())
                        : Optional.empty());
    }

    @Override
    public List<String> textRuns(Set<String> skippedElements) {
        List<String> runs = new ArrayList<>();
        collect(root(), skippedElements, runs);
        return runs;
    }

    private void collect(Element element, Set<String> skipped, List<String> runs) {
        if (skipped.contains(element.getName().toLowerCase())) return;
        for (Node node : element.content()) {
            if (node instanceof Element child) {
                collect(child, skipped, runs);
            } else if (node instanceof Text || node instanceof CDATA) {
                String text = node.getText().replaceAll("\\s+", " ").trim();
                if (!text.isEmpty()) runs.add(text);
            }
        }
    }
}
