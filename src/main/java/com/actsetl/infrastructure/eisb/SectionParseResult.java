package com.actsetl.infrastructure.eisb;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.provision.model.Provision;

import java.util.List;

/**
 * Provisions of one section, root container first, and the amendments the section makes.
 */
public record SectionParseResult(List<Provision> provisions, List<AmendmentMetadata> amendments) {

    public Provision root() {
        return provisions.get(0);
    }
}
