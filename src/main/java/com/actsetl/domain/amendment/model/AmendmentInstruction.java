package com.actsetl.domain.amendment.model;

/**
 * An amending phrase recognised in a paragraph.
 *
 * @param kind            substitution or insertion
 * @param inline          true when the new text is carried in the phrase itself
 * @param destinationText the phrase naming the amended location; empty when the phrase names none
 * @param position        where insertions go relative to the destination, null when unspecified
 * @param newText         quoted replacement text, inline substitutions only
 * @param oldText         quoted replaced text, inline substitutions only
 */
public record AmendmentInstruction(
        AmendmentKind kind,
        boolean inline,
        String destinationText,
        AmendmentPosition position,
        String newText,
        String oldText
) {

    public static AmendmentInstruction inlineSubstitution(String newText, String oldText) {
        return new AmendmentInstruction(AmendmentKind.SUBSTITUTION, true, null, null, newText, oldText);
    }

    public static AmendmentInstruction block(AmendmentKind kind, String destinationText, AmendmentPosition position) {
        return new AmendmentInstruction(kind, false, destinationText, position, null, null);
    }
}
