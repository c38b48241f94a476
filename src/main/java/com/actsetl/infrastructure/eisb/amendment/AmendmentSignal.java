package com.actsetl.infrastructure.eisb.amendment;

/**
 * What the caller should do with the provision it just handed to the state machine.
 */
public enum AmendmentSignal {
    /** Forward the provision unchanged. */
    IDLE,
    /** Drop the provision; the state machine took it. */
    CONSUMED,
    /** Attach the returned mod element to the preceding provision. */
    COMPLETED_INLINE,
    /** Emit the returned block in place of the provision. */
    COMPLETED_BLOCK
}
