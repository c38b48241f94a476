package com.actsetl.infrastructure.eisb.provision;

import lombok.Getter;

/**
 * Running state of the classifier over one section: the next sequence index and
 * whether the last paragraph marker was (h), (u) or (w).
 */
@Getter
public class ClassificationContext {

    private int nextIndex = 0;
    private boolean afterHuwParagraph = false;

    int nextSequenceIndex() {
        return nextIndex++;
    }

    void recordParagraphMarker(String value) {
        afterHuwParagraph = value.equals("h") || value.equals("u") || value.equals("w");
    }
}
