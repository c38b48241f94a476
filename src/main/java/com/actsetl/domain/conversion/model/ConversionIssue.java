package com.actsetl.domain.conversion.model;

/**
 * An anomaly met while converting a document.
 *
 * @param type     the kind of anomaly
 * @param severity ERROR when content was dropped, WARNING when it was recovered
 * @param message  human-readable description
 * @param context  section or text the anomaly relates to (nullable)
 */
public record ConversionIssue(
        ConversionIssueType type,
        Severity severity,
        String message,
        String context
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public static ConversionIssue warning(ConversionIssueType type, String message, String context) {
        return new ConversionIssue(type, Severity.WARNING, message, context);
    }

    public static ConversionIssue error(ConversionIssueType type, String message, String context) {
        return new ConversionIssue(type, Severity.ERROR, message, context);
    }
}
