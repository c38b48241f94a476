package com.actsetl.infrastructure.eisb.hierarchy;

import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Nests a flat provision list into a tree. The first provision is the root; each structural
 * provision goes under the nearest open element of a shallower level, and text blocks, tables
 * and amendment blocks go into the content block of the innermost open element.
 */
@Slf4j
@Component
public class HierarchyBuilder {

    private record Frame(int level, Element element) {}

    public Element build(List<Provision> provisions) {
        return build(provisions, new ConversionIssues());
    }

    public Element build(List<Provision> provisions, ConversionIssues issues) {
        if (provisions.isEmpty() || !provisions.get(0).hasContent()) {
            throw new IllegalArgumentException("Provision list must start with a root container");
        }
        Provision root = provisions.get(0);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root.kind().level(), root.content()));

        for (Provision provision : provisions.subList(1, provisions.size())) {
            if (!provision.hasContent()) {
                continue;
            }
            if (provision.kind().isInline()) {
                contentBlock(stack.peek().element()).appendChild(provision.content());
                continue;
            }

            int level = provision.kind().level();
            while (stack.size() > 1 && stack.peek().level() >= level) {
                stack.pop();
            }
            Frame parent = stack.peek();
            if (parent.level() >= level) {
                String rootEid = root.content().attr("eId");
                log.warn("No enclosing element for {} {} in {}, attaching to root",
                        provision.kind(), provision.identifier(), rootEid);
                issues.warn(ConversionIssueType.UNATTACHABLE_PROVISION,
                        "No enclosing element for " + provision.kind() + " " + provision.identifier(),
                        rootEid);
            }
            attach(parent.element(), provision);
            stack.push(new Frame(level, provision.content()));
        }
        return root.content();
    }

    private void attach(Element parent, Provision provision) {
        Element child = provision.content();
        String eid = Eids.join(parent.attr("eId"), provision.identifier());
        if (eid != null) {
            XmlNodes.attr(child, "eId", eid);
        } else {
            child.removeAttr("eId");
        }
        Element previous = parent.children().last();
        if (XmlNodes.hasName(previous, "content")) {
            previous.tagName("intro");
        }
        parent.appendChild(child);
    }

    private Element contentBlock(Element parent) {
        return XmlNodes.child(parent, "content").orElseGet(() -> {
            Element content = XmlNodes.element("content");
            parent.appendChild(content);
            return content;
        });
    }
}
