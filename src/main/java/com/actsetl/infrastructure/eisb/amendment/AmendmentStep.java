package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.domain.provision.model.Provision;
import org.jsoup.nodes.Element;

/**
 * Result of feeding one provision to the state machine.
 *
 * @param signal    what to do with the provision
 * @param element   the completed mod or block element, null unless completed
 * @param provision the provision that was fed in
 */
public record AmendmentStep(AmendmentSignal signal, Element element, Provision provision) {

    static AmendmentStep idle(Provision provision) {
        return new AmendmentStep(AmendmentSignal.IDLE, null, provision);
    }

    static AmendmentStep consumed(Provision provision) {
        return new AmendmentStep(AmendmentSignal.CONSUMED, null, provision);
    }
}
