package com.actsetl.infrastructure.eisb;

import com.actsetl.domain.amendment.model.AmendmentMetadata;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * The filled target element and the amendments found beneath it, in document order.
 */
public record BodyParseResult(Element target, List<AmendmentMetadata> amendments) {
}
