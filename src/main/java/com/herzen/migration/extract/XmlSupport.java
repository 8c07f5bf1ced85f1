package com.herzen.migration.extract;

import org.dom4j.*;
import org.dom4j.io.SAXReader;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class XmlSupport {
    private XmlSupport() {
    }

    public static Document read(String xml) throws DocumentException {
        SAXReader reader = SAXReader.createDefault();
        reader.setEncoding("UTF-8");
        return reader.read(new StringReader(stripBom(xml)));
    }

    public static Optional<Element> firstDescendant(Element root, String localName) {
        if (root == null) return Optional.empty();
        for (Element child : root.elements()) {
            if (localName.equalsIgnoreCase(child.getName())) return Optional.of(child);
            Optional<Element> nested = firstDescendant(child, localName);
            if (nested.isPresent()) return nested;
        }
        return Optional.empty();
    }

    public static Optional<Element> firstSelfOrDescendant(Element root, String localName) {
        if (root != null && localName.equalsIgnoreCase(root.getName())) return Optional.of(root);
        return firstDescendant(root, localName);
    }

    public static List<Element> descendants(Element root, String localName) {
        List<Element> found = new ArrayList<>();
        collect(root, Set.of(localName.toLowerCase()), found);
        return found;
    }

    public static List<Element> descendants(Element root, Set<String> localNames) {
        List<Element> found = new ArrayList<>();
        collect(root, localNames, found);
        return found;
    }

    public static String text(Element element) {
        return element == null ? "" : element.getText().trim();
    }

    public static String childText(Element parent, String localName) {
        return firstDescendant(parent, localName).map(XmlSupport::text).orElse("");
    }

    public static String attribute(Element element, String name) {
        if (element == null) return null;
        String value = element.attributeValue(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Content between the element's tags. Text-only elements return their text, which carries
     * escaped HTML in most exports; mixed content is serialised node by node.
     */
    public static String innerContent(Element element) {
        if (element.elements().isEmpty()) return element.getText();
        StringBuilder sb = new StringBuilder();
        for (Node node : element.content()) {
            if (node instanceof CDATA) sb.append(node.getText());
            else if (node instanceof Comment || node instanceof ProcessingInstruction) continue;
            else sb.append(node.asXML());
        }
        return sb.toString();
    }

    private static void collect(Element root, Set<String> names, List<Element> found) {
        if (root == null) return;
        for (Element child : root.elements()) {
            if (names.contains(child.getName().toLowerCase())) found.add(child);
            collect(child, names, found);
        }
    }

    private static String stripBom(String xml) {
        return xml != null && !xml.isEmpty() && xml.charAt(0) == '\uFEFF' ? xml.substring(1) : xml;
    }
}
