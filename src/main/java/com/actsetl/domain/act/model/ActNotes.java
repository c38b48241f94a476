package com.actsetl.domain.act.model;

import java.util.List;

/**
 * Editorial notes for one act, keyed by the act's work URI.
 */
public record ActNotes(String actUri, List<EditorialNote> notes) {

    public ActNotes {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
