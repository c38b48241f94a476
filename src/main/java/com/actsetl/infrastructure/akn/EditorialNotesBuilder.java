package com.actsetl.infrastructure.akn;

import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.act.model.EditorialNote;
import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Adds editorial notes to the document metadata and marks the annotated provisions
 * with a {@code noteRef} in their number.
 */
@Slf4j
@Component
public class EditorialNotesBuilder {

    static final String NOTE_MARKER = "*";

    /**
     * Applies the note sets whose act URI is {@code workUri}. Returns the number of notes added.
     */
    public int apply(Element act, String workUri, List<ActNotes> noteSets, ConversionIssues issues) {
        if (noteSets == null || noteSets.isEmpty()) {
            return 0;
        }
        List<EditorialNote> notes = noteSets.stream()
                .filter(set -> workUri.equals(set.actUri()))
                .flatMap(set -> set.notes().stream())
                .toList();
        Element meta = act.selectFirst("act > meta");
        if (notes.isEmpty() || meta == null) {
            return 0;
        }

        Element notesBlock = XmlNodes.element("notes");
        notesBlock.attr("source", "#source");
        Element body = act.selectFirst("act > body");
        for (EditorialNote note : notes) {
            String noteEid = "note-" + note.eId();
            notesBlock.appendChild(note(note, noteEid));

            Optional<Element> number = body == null ? Optional.empty() : annotatedNumber(body, note.eId());
            if (number.isPresent()) {
                Element noteRef = XmlNodes.element("noteRef");
                noteRef.attr("href", "#" + noteEid);
                noteRef.attr("marker", NOTE_MARKER);
                number.get().appendChild(noteRef);
            } else {
                log.warn("No numbered provision matches note target {}", note.eId());
                issues.warn(ConversionIssueType.UNKNOWN_NOTE_TARGET,
                        "No numbered provision matches note target", note.eId());
            }
        }
        meta.appendChild(notesBlock);
        log.info("Added {} editorial notes to {}", notes.size(), workUri);
        return notes.size();
    }

    private static Element note(EditorialNote note, String noteEid) {
        Element element = XmlNodes.element("note");
        if (note.noteClass() != null) {
            element.attr("class", note.noteClass());
        }
        XmlNodes.attr(element, "eId", noteEid);
        element.appendChild(XmlNodes.element("p", note.note() != null ? note.note() : ""));
        return element;
    }

    /**
     * Number of the first body element, in document order, whose eId contains {@code eIdFragment}.
     */
    private static Optional<Element> annotatedNumber(Element body, String eIdFragment) {
        if (eIdFragment == null || eIdFragment.isBlank()) {
            return Optional.empty();
        }
        for (Element element : body.getAllElements()) {
            if (element.attr("eId").contains(eIdFragment)) {
                Optional<Element> number = XmlNodes.child(element, "num");
                if (number.isPresent()) {
                    return number;
                }
            }
        }
        return Optional.empty();
    }
}
