package com.actsetl.domain.amendment.model;

public enum AmendmentPosition {
    BEFORE("before"),
    AFTER("after");

    private final String value;

    AmendmentPosition(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
