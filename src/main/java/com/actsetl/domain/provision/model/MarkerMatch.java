package com.actsetl.domain.provision.model;

/**
 * A structural marker found at the start of a paragraph.
 *
 * @param kind      the kind the marker shape suggests; lowercase markers always report {@link ProvisionKind#PARAGRAPH}
 * @param marker    the marker as written, e.g. {@code (1)} or {@code “(a)}
 * @param remainder the text after the marker, leading whitespace removed
 */
public record MarkerMatch(ProvisionKind kind, String marker, String remainder) {

    /**
     * The marker without any leading or trailing quotation mark.
     */
    public String label() {
        return marker.replaceAll("^[“”]", "");
    }

    /**
     * The characters between the parentheses.
     */
    public String value() {
        String label = label();
        return label.substring(1, label.length() - 1);
    }
}
