package com.actsetl.infrastructure.akn;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders amendment metadata as the {@code activeModifications} block of the document metadata.
 */
@Slf4j
@Component
public class ActiveModificationsBuilder {

    public Element buildActiveModifications(List<AmendmentMetadata> amendments) {
        Element activeModifications = XmlNodes.element("activeModifications");
        for (AmendmentMetadata amendment : amendments) {
            activeModifications.appendChild(textualMod(amendment));
        }
        return activeModifications;
    }

    /**
     * Replaces the skeleton's {@code analysis/activeModifications} block. With no amendments the
     * empty analysis block is removed.
     */
    public void apply(Element document, List<AmendmentMetadata> amendments) {
        Element analysis = document.selectFirst("meta > analysis");
        if (analysis == null) {
            return;
        }
        analysis.select("> activeModifications").remove();
        if (amendments.isEmpty()) {
            if (analysis.children().isEmpty()) {
                analysis.remove();
            }
            return;
        }
        analysis.prependChild(buildActiveModifications(amendments));
        log.info("Recorded {} active modifications", amendments.size());
    }

    private Element textualMod(AmendmentMetadata amendment) {
        Element textualMod = XmlNodes.element("textualMod");
        textualMod.attr("type", amendment.kind().value());

        Element source = XmlNodes.element("source");
        source.attr("href", amendment.sourceReference());
        textualMod.appendChild(source);

        Element destination = XmlNodes.element("destination");
        destination.attr("href", amendment.destinationReference());
        if (amendment.position() != null) {
            destination.attr("pos", amendment.position().value());
        }
        textualMod.appendChild(destination);

        if (amendment.oldText() != null) {
            textualMod.appendChild(XmlNodes.element("old", amendment.oldText()));
        }
        if (amendment.newText() != null) {
            textualMod.appendChild(XmlNodes.element("new", amendment.newText()));
        }
        return textualMod;
    }
}
