package com.actsetl.infrastructure.eisb.normalize;

import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Replaces eISB character-entity elements ({@code <odq/>}, {@code <euro/>}, {@code <afada/>}, ...)
 * with the characters they stand for.
 */
@Slf4j
@Component
public class EntityNormalizer {

    private static final Map<String, String> ENTITIES = Map.ofEntries(
            Map.entry("odq", "“"),
            Map.entry("cdq", "”"),
            Map.entry("osq", "‘"),
            Map.entry("csq", "’"),
            Map.entry("euro", "€"),
            Map.entry("pound", "£"),
            Map.entry("ndash", "–"),
            Map.entry("mdash", "—"),
            Map.entry("nbsp", " "),
            Map.entry("ellipsis", "…"),
            Map.entry("section", "§"),
            Map.entry("afada", "á"),
            Map.entry("efada", "é"),
            Map.entry("ifada", "í"),
            Map.entry("ofada", "ó"),
            Map.entry("ufada", "ú"),
            Map.entry("Afada", "Á"),
            Map.entry("Efada", "É"),
            Map.entry("Ifada", "Í"),
            Map.entry("Ofada", "Ó"),
            Map.entry("Ufada", "Ú")
    );

    /**
     * Replaces entity elements in place and merges the resulting text runs.
     *
     * @return the number of entities replaced
     */
    public int normalize(Element root) {
        int replaced = 0;
        List<Element> candidates = root.getAllElements();
        for (Element element : candidates) {
            if (element == root || element.childNodeSize() > 0) {
                continue;
            }
            String character = ENTITIES.get(element.tagName());
            if (character != null) {
                element.replaceWith(new TextNode(character));
                replaced++;
            }
        }
        XmlNodes.coalesceText(root);
        log.debug("Replaced {} entity elements", replaced);
        return replaced;
    }
}
