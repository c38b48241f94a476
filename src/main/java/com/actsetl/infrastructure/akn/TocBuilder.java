package com.actsetl.infrastructure.akn;

import com.actsetl.infrastructure.xml.XmlNodes;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Fills the cover page table of contents from the assembled body. Inserted text inside
 * quoted structures is not listed.
 */
@Component
public class TocBuilder {

    private static final Set<String> DIVISIONS = Set.of("part", "chapter", "division");

    public int buildToc(Element act) {
        Element toc = act.selectFirst("coverPage > toc");
        Element body = act.selectFirst("act > body");
        if (toc == null || body == null) {
            return 0;
        }
        toc.empty();
        addItems(body, toc, 1);
        return toc.children().size();
    }

    private void addItems(Element parent, Element toc, int level) {
        for (Element child : parent.children()) {
            String name = child.tagName();
            boolean division = DIVISIONS.contains(name);
            boolean schedule = name.equals("hcontainer") && child.attr("name").equals("schedule");
            if (division || schedule || name.equals("section")) {
                toc.appendChild(tocItem(child, level));
            }
            if (division) {
                addItems(child, toc, level + 1);
            }
        }
    }

    private Element tocItem(Element target, int level) {
        Element item = XmlNodes.element("tocItem");
        item.attr("level", Integer.toString(level));
        item.attr("class", target.attr("name").isEmpty() ? target.tagName() : target.attr("name"));
        item.attr("href", "#" + target.attr("eId"));
        item.appendChild(XmlNodes.element("inline", XmlNodes.child(target, "num").map(Element::text).orElse("")));
        item.children().last().attr("name", "tocNum");
        item.appendChild(XmlNodes.element("inline", XmlNodes.child(target, "heading").map(Element::text).orElse("")));
        item.children().last().attr("name", "tocHeading");
        return item;
    }
}
