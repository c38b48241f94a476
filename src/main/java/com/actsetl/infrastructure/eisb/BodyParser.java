package com.actsetl.infrastructure.eisb;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.infrastructure.eisb.hierarchy.Eids;
import com.actsetl.infrastructure.eisb.hierarchy.HierarchyBuilder;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Walks the eISB body depth-first. Parts, chapters and divisions become containers with
 * their number and heading; each section is parsed and nested on its own. Amendments are
 * collected in document order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BodyParser {

    private static final Set<String> DIVISION_TAGS = Set.of("part", "chapter", "division");

    /** Divisions whose identifier is qualified by the enclosing division's. */
    private static final Set<String> NESTED_DIVISION_TAGS = Set.of("chapter", "division");

    private final SectionParser sectionParser;
    private final HierarchyBuilder hierarchyBuilder;
    private final ParagraphNormalizer paragraphNormalizer;

    public BodyParseResult parseBody(Element source, Element target) {
        return parseBody(source, target, new ConversionIssues());
    }

    public BodyParseResult parseBody(Element source, Element target, ConversionIssues issues) {
        List<AmendmentMetadata> amendments = new ArrayList<>();
        for (Element child : new ArrayList<>(source.children())) {
            String name = child.tagName();
            if (name.equals("sect")) {
                parseSection(child, target, issues, amendments);
            } else if (DIVISION_TAGS.contains(name)) {
                Element division = division(child, target);
                target.appendChild(division);
                amendments.addAll(parseBody(child, division, issues).amendments());
            }
        }
        return new BodyParseResult(target, amendments);
    }

    private void parseSection(Element section, Element target, ConversionIssues issues,
                              List<AmendmentMetadata> amendments) {
        try {
            SectionParseResult result = sectionParser.parseSection(section, issues);
            target.appendChild(hierarchyBuilder.build(result.provisions(), issues));
            amendments.addAll(result.amendments());
        } catch (StructuralParseException e) {
            log.error("Skipping section: {}", e.getMessage());
            issues.error(ConversionIssueType.MISSING_SECTION_ANCHOR, e.getMessage(), e.getSectionContext());
        }
    }

    /**
     * The division's title holds its number ("PART 2") followed by its heading paragraph.
     */
    private Element division(Element source, Element parent) {
        String name = source.tagName();
        List<Element> titleParts = XmlNodes.child(source, "title")
                .map(Element::children)
                .map(List::copyOf)
                .orElse(List.of());
        String number = titleParts.isEmpty() ? "" : titleParts.get(0).text();
        String[] words = number.split(" ");
        String eid = Eids.snippet(name, words[words.length - 1]);
        if (NESTED_DIVISION_TAGS.contains(name)) {
            eid = Eids.join(parent.attr("eId"), eid);
        }

        Element division = XmlNodes.element(name);
        XmlNodes.attr(division, "eId", eid);
        division.appendChild(XmlNodes.element("num", number));
        if (titleParts.size() > 1) {
            Element heading = paragraphNormalizer.normalize(titleParts.get(1));
            heading.tagName("heading");
            division.appendChild(heading);
        }
        log.info("Parsing {} {}", name, number);
        return division;
    }
}
