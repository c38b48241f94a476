package com.actsetl.interfaces.api.dto;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.conversion.model.ConversionIssue;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record ConversionResponse(
        String aknXml,
        List<AmendmentEntry> amendments,
        List<IssueEntry> issues
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AmendmentEntry(
            String type,
            String source,
            String destination,
            String position,
            String oldText,
            String newText
    ) {
        static AmendmentEntry from(AmendmentMetadata amendment) {
            return new AmendmentEntry(
                    amendment.kind().value(),
                    amendment.sourceReference(),
                    amendment.destinationReference(),
                    amendment.position() != null ? amendment.position().value() : null,
                    amendment.oldText(),
                    amendment.newText());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IssueEntry(
            String type,
            String severity,
            String message,
            String context
    ) {
        static IssueEntry from(ConversionIssue issue) {
            return new IssueEntry(issue.type().name(), issue.severity().name(), issue.message(), issue.context());
        }
    }

    public static ConversionResponse from(ConversionResult result) {
        return new ConversionResponse(
                result.aknXml(),
                result.amendments().stream().map(AmendmentEntry::from).toList(),
                result.issues().stream().map(IssueEntry::from).toList());
    }
}
