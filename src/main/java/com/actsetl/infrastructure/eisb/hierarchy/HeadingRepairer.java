package com.actsetl.infrastructure.eisb.hierarchy;

import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recovers the headings of parts, chapters and schedules inserted by amendments.
 * <p>
 * Inside a quoted structure such a heading first arrives as a centered paragraph in the
 * content block following the container's number. That paragraph is renamed to
 * {@code heading} and moved up next to the number; a content block left empty is removed.
 * Running the pass again changes nothing.
 * </p>
 */
@Slf4j
@Component
public class HeadingRepairer {

    private static final String CONTAINERS =
            "quotedStructure > part, quotedStructure > chapter, quotedStructure > hcontainer[name=schedule]";

    public Element fixHeadings(Element root) {
        int repaired = 0;
        for (Element container : root.select(CONTAINERS)) {
            if (repair(container)) {
                repaired++;
            }
        }
        if (repaired > 0) {
            log.info("Repaired {} inserted headings", repaired);
        }
        return root;
    }

    private boolean repair(Element container) {
        Optional<Element> num = XmlNodes.child(container, "num");
        if (num.isEmpty()) {
            return false;
        }
        Element block = num.get().nextElementSibling();
        if (!XmlNodes.hasName(block, "content") && !XmlNodes.hasName(block, "intro")) {
            return false;
        }
        Optional<Element> paragraph = XmlNodes.child(block, "p");
        if (paragraph.isEmpty() || !paragraph.get().attr("style").contains("text-align:center")) {
            return false;
        }
        Element heading = paragraph.get();
        heading.tagName("heading");
        num.get().after(heading);
        if (XmlNodes.isEmpty(block)) {
            block.remove();
        }
        return true;
    }
}
