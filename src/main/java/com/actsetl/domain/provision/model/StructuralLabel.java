package com.actsetl.domain.provision.model;

/**
 * A stand-alone heading label such as {@code PART 3} or {@code SCHEDULE 2}.
 */
public record StructuralLabel(ProvisionKind kind, String label, String number) {
}
