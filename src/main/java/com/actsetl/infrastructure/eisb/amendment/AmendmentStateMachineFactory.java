package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.infrastructure.eisb.ConversionIssues;
import com.actsetl.infrastructure.eisb.hierarchy.HierarchyBuilder;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates one {@link AmendmentStateMachine} per section, sharing the configured principal act URI.
 */
@Component
public class AmendmentStateMachineFactory {

    private final PatternLibrary patternLibrary;
    private final HierarchyBuilder hierarchyBuilder;
    private final String principalActUri;

    public AmendmentStateMachineFactory(PatternLibrary patternLibrary,
                                        HierarchyBuilder hierarchyBuilder,
                                        @Value("${actsetl.principal-act-uri:#principal_act}") String principalActUri) {
        this.patternLibrary = patternLibrary;
        this.hierarchyBuilder = hierarchyBuilder;
        this.principalActUri = principalActUri;
    }

    public AmendmentStateMachine create(String sectionEid, ConversionIssues issues) {
        return new AmendmentStateMachine(sectionEid, principalActUri, patternLibrary, hierarchyBuilder, issues);
    }
}
