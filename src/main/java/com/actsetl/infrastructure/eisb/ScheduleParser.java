package com.actsetl.infrastructure.eisb;

import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.normalize.TableNormalizer;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends the act's schedules to the body. Schedule text is kept as a flat run of
 * paragraphs and tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleParser {

    private final ParagraphNormalizer paragraphNormalizer;
    private final TableNormalizer tableNormalizer;

    public int parseSchedules(Element act, Element body) {
        List<Element> schedules = XmlNodes.child(act, "backmatter")
                .map(backmatter -> XmlNodes.children(backmatter, "schedule"))
                .orElse(List.of());
        for (int i = 0; i < schedules.size(); i++) {
            body.appendChild(schedule(schedules.get(i), i + 1));
        }
        if (!schedules.isEmpty()) {
            log.info("Parsed {} schedules", schedules.size());
        }
        return schedules.size();
    }

    private Element schedule(Element source, int index) {
        List<Element> titleParagraphs = XmlNodes.child(source, "title")
                .map(title -> XmlNodes.children(title, "p"))
                .orElse(List.of());
        String number = titleParagraphs.isEmpty() ? "" : titleParagraphs.get(0).text();
        String heading = titleParagraphs.size() > 1 ? titleParagraphs.get(1).text() : "";

        Element schedule = XmlNodes.element("hcontainer");
        schedule.attr("name", "schedule");
        XmlNodes.attr(schedule, "eId", "sched_" + index);
        schedule.appendChild(XmlNodes.element("num", number));
        schedule.appendChild(XmlNodes.element("heading", heading));
        Element content = XmlNodes.element("content");
        schedule.appendChild(content);

        for (Element child : new ArrayList<>(source.children())) {
            if (XmlNodes.hasName(child, "p")) {
                content.appendChild(paragraphNormalizer.normalize(child));
            } else if (XmlNodes.hasName(child, "table")) {
                content.appendChild(tableNormalizer.normalize(child));
            }
        }
        return schedule;
    }
}
