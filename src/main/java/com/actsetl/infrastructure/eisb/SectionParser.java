package com.actsetl.infrastructure.eisb;

import com.actsetl.domain.provision.model.Layout;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.infrastructure.eisb.amendment.AmendmentOutcome;
import com.actsetl.infrastructure.eisb.amendment.AmendmentProcessor;
import com.actsetl.infrastructure.eisb.amendment.AmendmentStateMachine;
import com.actsetl.infrastructure.eisb.amendment.AmendmentStateMachineFactory;
import com.actsetl.infrastructure.eisb.hierarchy.Eids;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.provision.ClassificationContext;
import com.actsetl.infrastructure.eisb.provision.ProvisionClassifier;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads one eISB {@code <sect>}: builds the section container, classifies its paragraphs and
 * tables and resolves the amendments among them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionParser {

    private final ProvisionClassifier classifier;
    private final ParagraphNormalizer paragraphNormalizer;
    private final AmendmentStateMachineFactory stateMachineFactory;
    private final AmendmentProcessor amendmentProcessor;

    public SectionParseResult parseSection(Element section) {
        return parseSection(section, new ConversionIssues());
    }

    /**
     * @throws StructuralParseException when the section has no number or no title paragraph
     */
    public SectionParseResult parseSection(Element section, ConversionIssues issues) {
        String number = XmlNodes.child(section, "number")
                .map(Element::text)
                .filter(text -> !text.isBlank())
                .orElseThrow(() -> new StructuralParseException("Section has no <number>", describe(section)));
        Element title = XmlNodes.child(section, "title")
                .flatMap(t -> XmlNodes.child(t, "p"))
                .orElseThrow(() -> new StructuralParseException(
                        "Section " + number + " has no <title><p>", describe(section)));

        log.info("Parsing section {}", number);
        String eid = Eids.snippet(ProvisionKind.SECTION.eidLabel(), number);
        Element container = XmlNodes.element(ProvisionKind.SECTION.elementName());
        XmlNodes.attr(container, "eId", eid);
        Element num = XmlNodes.element("num");
        num.appendChild(XmlNodes.element("b", number));
        container.appendChild(num);
        Element heading = paragraphNormalizer.normalize(title);
        heading.tagName("heading");
        container.appendChild(heading);

        ClassificationContext context = new ClassificationContext();
        List<Provision> classified = new ArrayList<>();
        for (Element child : new ArrayList<>(section.children())) {
            if (XmlNodes.hasName(child, "p") || XmlNodes.hasName(child, "table")) {
                classified.addAll(classifier.classify(child, context));
            }
        }

        AmendmentStateMachine machine = stateMachineFactory.create(eid, issues);
        AmendmentOutcome outcome = amendmentProcessor.processAmendmentsAndBuild(machine, classified, issues);

        List<Provision> provisions = new ArrayList<>();
        provisions.add(new Provision(ProvisionKind.SECTION, eid, false, Layout.SECTION, container, heading.text(), -1));
        provisions.addAll(outcome.provisions());
        return new SectionParseResult(provisions, outcome.amendments());
    }

    private static String describe(Element section) {
        String text = section.text();
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
