package com.actsetl.domain.amendment.model;

public enum AmendmentKind {
    SUBSTITUTION("substitution"),
    INSERTION("insertion");

    private final String value;

    AmendmentKind(String value) {
        this.value = value;
    }

    /**
     * Value written to the {@code type} attribute of a textual modification.
     */
    public String value() {
        return value;
    }
}
