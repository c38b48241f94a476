package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.provision.model.Provision;

import java.util.List;

/**
 * Provisions left after amendment processing, and the amendments found among them.
 */
public record AmendmentOutcome(List<Provision> provisions, List<AmendmentMetadata> amendments) {
}
