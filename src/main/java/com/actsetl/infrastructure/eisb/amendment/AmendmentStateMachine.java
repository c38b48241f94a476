package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.domain.amendment.model.AmendmentInstruction;
import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.amendment.model.DestinationComponent;
import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.domain.provision.model.Layout;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import com.actsetl.infrastructure.eisb.hierarchy.Eids;
import com.actsetl.infrastructure.eisb.hierarchy.HierarchyBuilder;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recognises amending instructions in the provisions of one section and gathers the
 * quoted text that follows them into {@code mod} elements.
 * <p>
 * One instance per section. Provisions fed in are never modified: quoted content is
 * copied before it is rebuilt.
 * </p>
 */
@Slf4j
public class AmendmentStateMachine {

    private final String sectionEid;
    private final String principalActUri;
    private final PatternLibrary patternLibrary;
    private final HierarchyBuilder hierarchyBuilder;
    private final ConversionIssues issues;

    private final List<AmendmentMetadata> amendments = new ArrayList<>();
    private final List<Provision> buffer = new ArrayList<>();

    private AmendmentState state = AmendmentState.IDLE;
    private int modCounter = 1;
    private AmendmentInstruction pendingInstruction;
    private Element currentMod;
    private Element currentQuotedStructure;

    public AmendmentStateMachine(String sectionEid,
                                 String principalActUri,
                                 PatternLibrary patternLibrary,
                                 HierarchyBuilder hierarchyBuilder,
                                 ConversionIssues issues) {
        this.sectionEid = sectionEid;
        this.principalActUri = principalActUri;
        this.patternLibrary = patternLibrary;
        this.hierarchyBuilder = hierarchyBuilder;
        this.issues = issues;
    }

    public AmendmentStep process(Provision provision) {
        return switch (state) {
            case IDLE -> processIdle(provision);
            case PARSING_INSTRUCTION -> processInstruction(provision);
            case CONSUMING_CONTENT -> processContent(provision);
        };
    }

    /**
     * Closes whatever is still open at the end of the section. A quotation that never closed
     * is emitted as it stands; an instruction that never received its quotation is dropped.
     */
    public Optional<Element> finish() {
        if (state == AmendmentState.CONSUMING_CONTENT) {
            log.warn("Quotation in {} was never closed, emitting {} buffered provisions",
                    sectionEid, buffer.size());
            issues.warn(ConversionIssueType.UNCLOSED_QUOTATION,
                    "Quotation was never closed", currentMod.attr("eId"));
            return Optional.of(closeQuotation(""));
        }
        if (state == AmendmentState.PARSING_INSTRUCTION) {
            log.warn("Amending instruction in {} was not followed by a quotation", sectionEid);
            issues.warn(ConversionIssueType.DANGLING_INSTRUCTION,
                    "Amending instruction was not followed by a quotation", sectionEid);
            reset();
        }
        return Optional.empty();
    }

    public AmendmentState getState() {
        return state;
    }

    /**
     * Amendment metadata recorded so far, in the order the amendments were met.
     */
    public List<AmendmentMetadata> getAmendments() {
        return List.copyOf(amendments);
    }

    private AmendmentStep processIdle(Provision provision) {
        if (provision.kind() == ProvisionKind.QUOTE_END) {
            log.warn("Closing quotation {} without an opening one in {}", provision.rawText(), sectionEid);
            issues.warn(ConversionIssueType.STRAY_QUOTE_END,
                    "Closing quotation without an opening one", sectionEid);
            return AmendmentStep.consumed(provision);
        }
        // Structural provisions repeat their text block's text; only the text block is read.
        if (provision.kind() != ProvisionKind.TBLOCK) {
            return AmendmentStep.idle(provision);
        }
        Optional<AmendmentInstruction> match = patternLibrary.matchInstruction(provision.rawText());
        if (match.isEmpty()) {
            return AmendmentStep.idle(provision);
        }

        AmendmentInstruction instruction = match.get();
        if (instruction.inline()) {
            return completeInline(provision, instruction);
        }
        pendingInstruction = instruction;
        state = AmendmentState.PARSING_INSTRUCTION;
        log.debug("Amending instruction in {}: {} {}", sectionEid, instruction.kind(), instruction.destinationText());
        return AmendmentStep.consumed(provision);
    }

    private AmendmentStep processInstruction(Provision provision) {
        if (!patternLibrary.opensQuotation(provision.rawText())) {
            return AmendmentStep.consumed(provision);
        }
        String modEid = Eids.mod(sectionEid, modCounter);
        currentQuotedStructure = XmlNodes.element("quotedStructure");
        XmlNodes.attr(currentQuotedStructure, "eId", Eids.quotedStructure(modEid));
        XmlNodes.attr(currentQuotedStructure, "startQuote", PatternLibrary.OPEN_DOUBLE_QUOTE);
        currentMod = XmlNodes.element("mod");
        XmlNodes.attr(currentMod, "eId", modEid);
        currentMod.appendChild(currentQuotedStructure);

        amendments.add(new AmendmentMetadata(
                pendingInstruction.kind(),
                "#" + modEid,
                destinationUri(pendingInstruction.destinationText()),
                pendingInstruction.position(),
                null,
                null));

        state = AmendmentState.CONSUMING_CONTENT;
        if (provision.hasContent()) {
            Element content = provision.content().clone();
            String leading = XmlNodes.leadingText(content);
            if (leading.startsWith(PatternLibrary.OPEN_DOUBLE_QUOTE)) {
                XmlNodes.replaceLeadingText(content, leading.substring(1));
            }
            if (!XmlNodes.isEmpty(content) || provision.kind().isStructural()) {
                buffer.add(provision.withContent(content));
            }
        }
        return AmendmentStep.consumed(provision);
    }

    private AmendmentStep processContent(Provision provision) {
        if (provision.kind() != ProvisionKind.QUOTE_END) {
            if (provision.hasContent()) {
                buffer.add(provision.withContent(provision.content().clone()));
            }
            return AmendmentStep.consumed(provision);
        }
        Element block = closeQuotation(provision.rawText());
        return new AmendmentStep(AmendmentSignal.COMPLETED_BLOCK, block, provision);
    }

    private Element closeQuotation(String endQuote) {
        Element block = XmlNodes.element("block");
        block.attr("name", "quotedStructure");
        if (currentQuotedStructure == null) {
            log.error("Quotation closed in {} without an open quoted structure", sectionEid);
            reset();
            return block;
        }

        XmlNodes.attr(currentQuotedStructure, "endQuote", endQuote);
        if (!buffer.isEmpty()) {
            if (!endQuote.isEmpty()) {
                Provision last = buffer.get(buffer.size() - 1);
                XmlNodes.stripTrailingText(last.content(), endQuote);
                // A closing quote on a paragraph of its own leaves nothing behind
                if (!last.kind().isStructural() && XmlNodes.isEmpty(last.content())) {
                    buffer.remove(buffer.size() - 1);
                }
            }
            List<Provision> quoted = new ArrayList<>();
            Element container = XmlNodes.element(ProvisionKind.CONTAINER.elementName());
            XmlNodes.attr(container, "eId", currentQuotedStructure.attr("eId"));
            quoted.add(new Provision(ProvisionKind.CONTAINER, null, true, Layout.DEFAULT, container, "", -1));
            quoted.addAll(buffer);
            Element rebuilt = hierarchyBuilder.build(quoted, issues);
            XmlNodes.moveChildren(rebuilt, currentQuotedStructure);
        }
        block.appendChild(currentMod);

        modCounter++;
        reset();
        return block;
    }

    private AmendmentStep completeInline(Provision provision, AmendmentInstruction instruction) {
        String modEid = Eids.mod(sectionEid, modCounter);
        Element quotedText = XmlNodes.element("quotedText", instruction.newText());
        XmlNodes.attr(quotedText, "startQuote", PatternLibrary.OPEN_DOUBLE_QUOTE);
        XmlNodes.attr(quotedText, "endQuote", PatternLibrary.CLOSE_DOUBLE_QUOTE);
        Element mod = XmlNodes.element("mod");
        XmlNodes.attr(mod, "eId", modEid);
        mod.appendChild(quotedText);

        amendments.add(new AmendmentMetadata(
                instruction.kind(),
                "#" + modEid,
                destinationUri(provision.rawText()),
                null,
                instruction.oldText(),
                instruction.newText()));
        modCounter++;
        return new AmendmentStep(AmendmentSignal.COMPLETED_INLINE, mod, provision);
    }

    /**
     * Principal act URI followed by the amended location, e.g.
     * {@code #principal_act/section_118__subsect_5}. Falls back to the bare principal act URI
     * when no location can be read.
     */
    String destinationUri(String destinationText) {
        List<DestinationComponent> components = patternLibrary.parseDestination(destinationText);
        if (components.isEmpty()) {
            log.warn("Could not resolve amended location in {}: {}", sectionEid, destinationText);
            issues.warn(ConversionIssueType.UNRESOLVED_DESTINATION,
                    "Could not resolve amended location", destinationText);
            return principalActUri;
        }
        return principalActUri + "/" + components.stream()
                .map(DestinationComponent::toFragment)
                .collect(Collectors.joining("__"));
    }

    private void reset() {
        state = AmendmentState.IDLE;
        pendingInstruction = null;
        currentMod = null;
        currentQuotedStructure = null;
        buffer.clear();
    }
}
