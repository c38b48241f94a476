package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a section's provisions through an {@link AmendmentStateMachine} and applies its signals:
 * absorbed provisions are dropped, completed quotations take the place of their closing
 * provision and inline modifications are attached to the provision before them.
 */
@Slf4j
@Component
public class AmendmentProcessor {

    public AmendmentOutcome processAmendmentsAndBuild(AmendmentStateMachine machine,
                                                      List<Provision> provisions,
                                                      ConversionIssues issues) {
        List<Provision> processed = new ArrayList<>();
        for (Provision provision : provisions) {
            AmendmentStep step = machine.process(provision);
            switch (step.signal()) {
                case IDLE -> processed.add(provision);
                case CONSUMED -> {
                }
                case COMPLETED_BLOCK -> processed.add(modBlock(step.element(), provision));
                case COMPLETED_INLINE -> attachInline(processed, step.element(), provision, issues);
            }
        }

        Optional<Element> unclosed = machine.finish();
        unclosed.ifPresent(block -> processed.add(
                modBlock(block, provisions.get(provisions.size() - 1))));
        return new AmendmentOutcome(processed, machine.getAmendments());
    }

    /**
     * Appends the mod to the most recent earlier provision with content, copying that
     * provision's element so the input stays untouched.
     */
    private void attachInline(List<Provision> processed, Element mod, Provision trigger, ConversionIssues issues) {
        for (int i = processed.size() - 1; i >= 0; i--) {
            Provision candidate = processed.get(i);
            if (candidate.hasContent() && candidate.sequenceIndex() < trigger.sequenceIndex()) {
                Element content = candidate.content().clone();
                content.appendChild(mod);
                processed.set(i, candidate.withContent(content));
                return;
            }
        }
        log.warn("No provision before inline modification {}, emitting it on its own", mod.attr("eId"));
        issues.warn(ConversionIssueType.UNATTACHED_INLINE_MODIFICATION,
                "No provision before inline modification", mod.attr("eId"));
        processed.add(modBlock(mod, trigger));
    }

    private static Provision modBlock(Element block, Provision trigger) {
        return new Provision(ProvisionKind.MOD_BLOCK, null, true, trigger.layout(), block, null,
                trigger.sequenceIndex());
    }
}
