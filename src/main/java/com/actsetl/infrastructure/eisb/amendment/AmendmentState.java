package com.actsetl.infrastructure.eisb.amendment;

public enum AmendmentState {
    /** Passing provisions through, watching for an amending phrase. */
    IDLE,
    /** An amending phrase was seen; waiting for the opening quotation. */
    PARSING_INSTRUCTION,
    /** Inside a quotation; buffering the quoted provisions. */
    CONSUMING_CONTENT
}
