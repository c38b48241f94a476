package com.actsetl.domain.amendment.model;

/**
 * Describes one textual modification for the document's active modifications block.
 *
 * @param kind                 substitution or insertion
 * @param sourceReference      {@code #} followed by the mod element's identifier
 * @param destinationReference principal act URI plus the amended location
 * @param position             insertion position, nullable
 * @param oldText              replaced text, nullable
 * @param newText              replacement text, nullable
 */
public record AmendmentMetadata(
        AmendmentKind kind,
        String sourceReference,
        String destinationReference,
        AmendmentPosition position,
        String oldText,
        String newText
) {
}
