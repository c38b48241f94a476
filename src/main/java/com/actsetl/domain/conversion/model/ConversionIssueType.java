package com.actsetl.domain.conversion.model;

public enum ConversionIssueType {
    MISSING_SECTION_ANCHOR,
    STRAY_QUOTE_END,
    UNCLOSED_QUOTATION,
    DANGLING_INSTRUCTION,
    UNRESOLVED_DESTINATION,
    UNATTACHABLE_PROVISION,
    UNATTACHED_INLINE_MODIFICATION,
    UNKNOWN_NOTE_TARGET
}
