package com.actsetl.domain.act.model;

/**
 * An editorial note attached to one provision of an act.
 *
 * @param eId       identifier, or identifier fragment, of the annotated provision
 * @param note      note text
 * @param noteClass presentation class of the note, e.g. "editorial"
 */
public record EditorialNote(String eId, String note, String noteClass) {
}
