package com.actsetl.infrastructure.xml;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Small helpers over jsoup nodes for mixed-content XML, where text runs sit
 * between inline elements.
 */
public final class XmlNodes {

    private XmlNodes() {
    }

    /**
     * Creates a detached element, keeping the name's case.
     */
    public static Element element(String name) {
        return new Element(name);
    }

    public static Element element(String name, String text) {
        Element element = new Element(name);
        element.appendChild(new TextNode(text));
        return element;
    }

    /**
     * Sets an attribute keeping the key's case. {@link Element#attr(String, String)} lowercases
     * keys on elements that are not yet part of an XML document.
     */
    public static Element attr(Element element, String key, String value) {
        element.attributes().put(key, value);
        return element;
    }

    /**
     * First direct child with the given name.
     */
    public static Optional<Element> child(Element parent, String name) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public static List<Element> children(Element parent, String name) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(name)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public static boolean hasName(Element element, String name) {
        return element != null && element.tagName().equalsIgnoreCase(name);
    }

    /**
     * Raw text before the element's first child element.
     */
    public static String leadingText(Element element) {
        StringBuilder text = new StringBuilder();
        for (Node node : element.childNodes()) {
            if (!(node instanceof TextNode textNode)) {
                break;
            }
            text.append(textNode.getWholeText());
        }
        return text.toString();
    }

    /**
     * Replaces the text before the element's first child element.
     */
    public static void replaceLeadingText(Element element, String text) {
        while (element.childNodeSize() > 0 && element.childNode(0) instanceof TextNode) {
            element.childNode(0).remove();
        }
        if (!text.isEmpty()) {
            element.prependChild(new TextNode(text));
        }
    }

    /**
     * Removes {@code suffix} from the end of the last text run in the element, ignoring trailing whitespace.
     */
    public static boolean stripTrailingText(Element element, String suffix) {
        List<TextNode> textNodes = new ArrayList<>();
        collectTextNodes(element, textNodes);
        for (int i = textNodes.size() - 1; i >= 0; i--) {
            TextNode textNode = textNodes.get(i);
            String text = textNode.getWholeText().stripTrailing();
            if (text.isEmpty()) {
                continue;
            }
            if (text.endsWith(suffix)) {
                textNode.text(text.substring(0, text.length() - suffix.length()));
                return true;
            }
            return false;
        }
        return false;
    }

    /**
     * Merges adjacent text nodes throughout the subtree.
     */
    public static void coalesceText(Element element) {
        int i = 0;
        while (i < element.childNodeSize()) {
            Node node = element.childNode(i);
            if (node instanceof TextNode current
                    && i + 1 < element.childNodeSize()
                    && element.childNode(i + 1) instanceof TextNode next) {
                current.text(current.getWholeText() + next.getWholeText());
                next.remove();
                continue;
            }
            if (node instanceof Element child) {
                coalesceText(child);
            }
            i++;
        }
    }

    /**
     * Moves every child node of {@code source} to the end of {@code target}.
     */
    public static void moveChildren(Element source, Element target) {
        for (Node node : new ArrayList<>(source.childNodes())) {
            target.appendChild(node);
        }
    }

    /**
     * True when the element has neither child elements nor non-blank text.
     */
    public static boolean isEmpty(Element element) {
        return element.children().isEmpty() && element.text().isBlank();
    }

    private static void collectTextNodes(Element element, List<TextNode> into) {
        for (Node node : element.childNodes()) {
            if (node instanceof TextNode textNode) {
                into.add(textNode);
            } else if (node instanceof Element child) {
                collectTextNodes(child, into);
            }
        }
    }
}
