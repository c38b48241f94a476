package com.actsetl.domain.amendment.model;

/**
 * One level of an amended location, e.g. {@code subsect} / {@code 5}.
 */
public record DestinationComponent(String label, String identifier) {

    public String toFragment() {
        return label + "_" + identifier;
    }
}
