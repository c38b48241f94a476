package com.actsetl.infrastructure.eisb;

import com.actsetl.domain.conversion.model.ConversionIssue;
import com.actsetl.domain.conversion.model.ConversionIssueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects anomalies over one conversion run. Not thread-safe; one instance per document.
 */
public class ConversionIssues {

    private final List<ConversionIssue> issues = new ArrayList<>();

    public void warn(ConversionIssueType type, String message, String context) {
        issues.add(ConversionIssue.warning(type, message, context));
    }

    public void error(ConversionIssueType type, String message, String context) {
        issues.add(ConversionIssue.error(type, message, context));
    }

    public List<ConversionIssue> asList() {
        return List.copyOf(issues);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }
}
