package com.actsetl.infrastructure.eisb.normalize;

import com.actsetl.domain.provision.model.Layout;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites an eISB paragraph into a target {@code <p>}: layout becomes an inline style,
 * footnotes become references and images and Unicode escapes are resolved.
 * The element is modified in place.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParagraphNormalizer {

    private final PatternLibrary patternLibrary;

    public Element normalize(Element paragraph) {
        paragraph.tagName("p");
        String descriptor = paragraph.attr("class");

        for (Element child : new ArrayList<>(paragraph.getAllElements())) {
            if (child == paragraph) {
                continue;
            }
            switch (child.tagName()) {
                case "font", "xref" -> child.unwrap();
                case "fn" -> replaceFootnote(child);
                case "graphic" -> replaceGraphic(child);
                case "unicode" -> replaceUnicode(child);
                case "SB", "SU" -> child.tagName(child.tagName().toLowerCase());
                default -> {
                }
            }
        }
        XmlNodes.coalesceText(paragraph);

        for (Attribute attribute : new ArrayList<>(paragraph.attributes().asList())) {
            paragraph.removeAttr(attribute.getKey());
        }
        Layout.parseDescriptor(descriptor).ifPresent(layout -> paragraph.attr("style", layout.toStyle()));
        return paragraph;
    }

    private void replaceFootnote(Element footnote) {
        if (footnote.parent() == null) {
            return;
        }
        String marker = footnote.select("marker su").text();
        String target = footnoteTarget(footnote);
        String href = target.startsWith("OJ")
                ? patternLibrary.matchOfficialJournal(target).map(ref -> ref.toEurLexUri()).orElse("")
                : "";

        Element ref = XmlNodes.element("ref", marker);
        ref.attr("title", target);
        ref.attr("href", href);
        Element sup = XmlNodes.element("sup");
        sup.appendChild(ref);
        footnote.replaceWith(sup);
    }

    /**
     * The citation text follows the marker inside the footnote body.
     */
    private String footnoteTarget(Element footnote) {
        Element bodyMarker = footnote.selectFirst("p su");
        if (bodyMarker == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        Node next = bodyMarker.nextSibling();
        while (next instanceof TextNode textNode) {
            text.append(textNode.getWholeText());
            next = next.nextSibling();
        }
        return text.toString().strip();
    }

    private void replaceGraphic(Element graphic) {
        String href = graphic.attr("href");
        graphic.tagName("img");
        graphic.removeAttr("href");
        graphic.removeAttr("quality");
        graphic.attr("src", "/images/" + href);
    }

    private void replaceUnicode(Element unicode) {
        String code = unicode.attr("ch");
        try {
            String character = new String(Character.toChars(Integer.parseInt(code, 16)));
            unicode.replaceWith(new TextNode(character));
        } catch (IllegalArgumentException e) {
            log.warn("Dropping unicode escape with invalid code point '{}': {}", code, e.getMessage());
            unicode.remove();
        }
    }

    /**
     * Normalizes every direct {@code <p>} child of {@code parent}.
     */
    public List<Element> normalizeChildren(Element parent) {
        List<Element> paragraphs = XmlNodes.children(parent, "p");
        paragraphs.forEach(this::normalize);
        return paragraphs;
    }
}
