package com.actsetl.domain.conversion.model;

import com.actsetl.domain.amendment.model.AmendmentMetadata;

import java.util.List;

/**
 * Final result of converting one eISB document.
 *
 * @param aknXml     the serialized Akoma Ntoso document
 * @param amendments textual modifications found, in document order
 * @param issues     anomalies collected during the pass
 */
public record ConversionResult(
        String aknXml,
        List<AmendmentMetadata> amendments,
        List<ConversionIssue> issues
) {

    public boolean hasErrors() {
        return issues.stream().anyMatch(issue -> issue.severity() == ConversionIssue.Severity.ERROR);
    }
}
