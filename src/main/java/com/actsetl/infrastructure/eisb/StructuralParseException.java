package com.actsetl.infrastructure.eisb;

import lombok.Getter;

/**
 * A section lacks an element every section must have, such as its number or title.
 */
@Getter
public class StructuralParseException extends RuntimeException {

    private final String sectionContext;

    public StructuralParseException(String message, String sectionContext) {
        super(message + " [" + sectionContext + "]");
        this.sectionContext = sectionContext;
    }
}
