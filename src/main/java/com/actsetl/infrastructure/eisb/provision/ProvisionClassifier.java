package com.actsetl.infrastructure.eisb.provision;

import com.actsetl.domain.provision.model.Layout;
import com.actsetl.domain.provision.model.MarkerMatch;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.domain.provision.model.StructuralLabel;
import com.actsetl.infrastructure.eisb.hierarchy.Eids;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.normalize.TableNormalizer;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns one source paragraph or table of a section into provisions.
 * <p>
 * A paragraph may yield several provisions: an inserted section heading (bold number
 * at a deep indent), a structural container for a leading marker such as "(1)", the
 * remaining text block and a quotation-end marker.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProvisionClassifier {

    static final int INSERTED_SECTION_THRESHOLD = 8;
    static final int PARAGRAPH_MARGIN = 14;
    static final int SUBPARAGRAPH_MARGIN = 17;

    private final PatternLibrary patternLibrary;
    private final ParagraphNormalizer paragraphNormalizer;
    private final TableNormalizer tableNormalizer;

    public List<Provision> classify(Element node, ClassificationContext context) {
        List<Provision> provisions = new ArrayList<>();
        Layout layout = Layout.parse(node.attr("class"));

        // 1. Tables pass through whole
        if (XmlNodes.hasName(node, "table")) {
            String text = node.text();
            provisions.add(provision(ProvisionKind.TABLE, null, false, layout,
                    tableNormalizer.normalize(node), text, context));
            return provisions;
        }

        Element paragraph = paragraphNormalizer.normalize(node);
        String text = paragraph.text();

        // 2. Empty paragraphs keep their place
        if (text.isEmpty()) {
            provisions.add(provision(ProvisionKind.TBLOCK, null, false, layout, paragraph, text, context));
            return provisions;
        }

        mergeItalicMarker(paragraph);

        // 3. Stand-alone PART / CHAPTER / SCHEDULE labels of inserted text
        if (layout.isCentered()) {
            Optional<StructuralLabel> label = patternLibrary.matchStructuralLabel(text);
            if (label.isPresent()) {
                StructuralLabel structuralLabel = label.get();
                Element container = container(structuralLabel.kind(), structuralLabel.label());
                String identifier = Eids.snippet(structuralLabel.kind().eidLabel(), structuralLabel.number());
                provisions.add(provision(structuralLabel.kind(), identifier, true, layout, container, text, context));
                return provisions;
            }
        }

        // 4. Bold number at a deep indent: heading of an inserted section
        boolean inserted = false;
        Optional<Element> bold = XmlNodes.child(paragraph, "b");
        if (bold.isPresent() && hasTail(bold.get()) && layout.indent() > INSERTED_SECTION_THRESHOLD) {
            String number = bold.get().text().strip();
            bold.get().remove();
            XmlNodes.coalesceText(paragraph);
            inserted = true;
            String identifier = Eids.snippet(ProvisionKind.SECTION.eidLabel(), number);
            provisions.add(provision(ProvisionKind.SECTION, identifier, true, layout,
                    container(ProvisionKind.SECTION, stripOpeningQuote(number)), text, context));
        }

        // 5. Leading structural marker
        String leading = XmlNodes.leadingText(paragraph).stripLeading();
        Optional<MarkerMatch> marker = patternLibrary.matchMarker(leading);
        if (marker.isPresent()) {
            MarkerMatch match = marker.get();
            ProvisionKind kind = resolveKind(match, layout, context);
            XmlNodes.replaceLeadingText(paragraph, match.remainder());
            String identifier = Eids.snippet(kind.eidLabel(), match.value());
            provisions.add(provision(kind, identifier, inserted, layout,
                    container(kind, match.label()), text, context));
        }

        // 6. The paragraph text itself
        ProvisionKind blockKind = text.equals(PatternLibrary.OPEN_DOUBLE_QUOTE)
                ? ProvisionKind.QUOTE_START
                : ProvisionKind.TBLOCK;
        provisions.add(provision(blockKind, null, inserted, layout, paragraph, text, context));

        // 7. End of a quotation
        if (patternLibrary.closesQuotation(text)) {
            provisions.add(provision(ProvisionKind.QUOTE_END, null, true, layout,
                    null, patternLibrary.closingQuote(text), context));
        }
        return provisions;
    }

    /**
     * Letters i, v and x are both paragraph letters and roman numerals. A margin of 14
     * means paragraph. After paragraph (h), (u) or (w) the next letter is read as a paragraph;
     * otherwise an i/v/x marker is a subparagraph.
     * <p>
     * Known limitation: a genuine subparagraph (i) nested directly under paragraph (h) is
     * read as paragraph (i).
     * </p>
     */
    ProvisionKind resolveKind(MarkerMatch match, Layout layout, ClassificationContext context) {
        if (match.kind() != ProvisionKind.PARAGRAPH) {
            return match.kind();
        }
        String value = match.value();
        ProvisionKind kind;
        if (layout.margin() == PARAGRAPH_MARGIN) {
            kind = ProvisionKind.PARAGRAPH;
        } else if (context.isAfterHuwParagraph()) {
            kind = ProvisionKind.PARAGRAPH;
        } else if ("ivx".indexOf(value.charAt(0)) >= 0) {
            kind = ProvisionKind.SUBPARAGRAPH;
        } else {
            kind = ProvisionKind.PARAGRAPH;
        }
        context.recordParagraphMarker(value);
        return kind;
    }

    /**
     * Joins "(", an italic letter and ")" into one text run so the marker can be matched.
     */
    private void mergeItalicMarker(Element node) {
        if (node.childNodeSize() < 3 || !(node.childNode(0) instanceof TextNode opening)) {
            return;
        }
        if (!opening.getWholeText().equals("(")) {
            return;
        }
        Node second = node.childNode(1);
        if (!(second instanceof Element italic) || !XmlNodes.hasName(italic, "i")) {
            return;
        }
        if (!(node.childNode(2) instanceof TextNode closing) || !closing.getWholeText().startsWith(")")) {
            return;
        }
        opening.text("(" + italic.text() + closing.getWholeText());
        italic.remove();
        closing.remove();
    }

    private static boolean hasTail(Element element) {
        Node next = element.nextSibling();
        return next instanceof TextNode textNode && !textNode.getWholeText().isEmpty();
    }

    private static Element container(ProvisionKind kind, String number) {
        Element container = XmlNodes.element(kind.elementName());
        if (kind == ProvisionKind.SCHEDULE) {
            container.attr("name", "schedule");
        }
        container.appendChild(XmlNodes.element("num", number));
        return container;
    }

    private static String stripOpeningQuote(String text) {
        return text.startsWith(PatternLibrary.OPEN_DOUBLE_QUOTE) ? text.substring(1) : text;
    }

    private static Provision provision(ProvisionKind kind, String identifier, boolean inserted, Layout layout,
                                       Element content, String rawText, ClassificationContext context) {
        if (content != null && identifier != null) {
            XmlNodes.attr(content, "eId", identifier);
        }
        return new Provision(kind, identifier, inserted, layout, content, rawText, context.nextSequenceIndex());
    }
}
