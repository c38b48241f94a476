package com.actsetl.domain.provision.model;

import org.jsoup.nodes.Element;

/**
 * One classified piece of a section, in document order.
 *
 * @param kind          what the provision is
 * @param identifier    local identifier fragment such as {@code subsect_1}, null when it has none
 * @param inserted      true when the text belongs to an inserted (quoted) provision
 * @param layout        source indentation
 * @param content       target element, null for pure markers like a quotation end
 * @param rawText       whitespace-normalized source text, or the closing characters for a quotation end
 * @param sequenceIndex position in the classifier's output
 */
public record Provision(
        ProvisionKind kind,
        String identifier,
        boolean inserted,
        Layout layout,
        Element content,
        String rawText,
        int sequenceIndex
) {

    public boolean hasContent() {
        return content != null;
    }

    public Provision withContent(Element replacement) {
        return new Provision(kind, identifier, inserted, layout, replacement, rawText, sequenceIndex);
    }
}
