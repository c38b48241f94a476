package com.actsetl.infrastructure.eisb.amendment;

import com.actsetl.domain.conversion.model.ConversionIssue;
import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.domain.provision.model.Provision;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import com.actsetl.infrastructure.eisb.hierarchy.HierarchyBuilder;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.normalize.TableNormalizer;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.eisb.provision.ClassificationContext;
import com.actsetl.infrastructure.eisb.provision.ProvisionClassifier;
import com.actsetl.infrastructure.xml.XmlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AmendmentProcessorTest {

    private ProvisionClassifier classifier;
    private AmendmentStateMachineFactory factory;
    private AmendmentProcessor processor;
    private ConversionIssues issues;

    @BeforeEach
    void setUp() {
        PatternLibrary patterns = new PatternLibrary();
        ParagraphNormalizer paragraphs = new ParagraphNormalizer(patterns);
        classifier = new ProvisionClassifier(patterns, paragraphs, new TableNormalizer(paragraphs));
        factory = new AmendmentStateMachineFactory(patterns, new HierarchyBuilder(), "#principal_act");
        processor = new AmendmentProcessor();
        issues = new ConversionIssues();
    }

    private List<Provision> provisions(String... paragraphs) {
        ClassificationContext context = new ClassificationContext();
        List<Provision> provisions = new ArrayList<>();
        for (String paragraph : paragraphs) {
            provisions.addAll(classifier.classify(XmlFixtures.element(paragraph), context));
        }
        return provisions;
    }

    private AmendmentOutcome process(List<Provision> provisions) {
        return processor.processAmendmentsAndBuild(factory.create("sec_4", issues), provisions, issues);
    }

    @Test
    void plain_provisions_pass_through() {
        List<Provision> input = provisions("<p class=\"-3 11 0 left 1 0\">(1) In this Act</p>");

        AmendmentOutcome outcome = process(input);

        assertThat(outcome.provisions()).isEqualTo(input);
        assertThat(outcome.amendments()).isEmpty();
    }

    @Test
    void inline_modification_is_spliced_into_preceding_provision() {
        List<Provision> input = provisions(
                "<p class=\"-3 11 0 left 1 0\">(1) Section 7 is amended by the substitution of “€500” for “€100”.</p>");

        AmendmentOutcome outcome = process(input);

        assertThat(outcome.provisions()).hasSize(1);
        Provision subsection = outcome.provisions().get(0);
        assertThat(subsection.kind()).isEqualTo(ProvisionKind.SUBSECTION);
        assertThat(subsection.content().selectFirst("mod[eId=sec_4_mod_1] > quotedText").text()).isEqualTo("€500");
        assertThat(input.get(0).content().selectFirst("mod")).isNull();
        assertThat(outcome.amendments()).hasSize(1);
    }

    @Test
    void inline_modification_without_predecessor_stands_alone() {
        List<Provision> input = provisions(
                "<p class=\"0 0 0 left 1 0\">Section 7 is amended by the substitution of “€500” for “€100”.</p>");

        AmendmentOutcome outcome = process(input);

        assertThat(outcome.provisions()).extracting(Provision::kind).containsExactly(ProvisionKind.MOD_BLOCK);
        assertThat(outcome.provisions().get(0).content().tagName()).isEqualTo("mod");
        assertThat(issues.asList()).extracting(ConversionIssue::type)
                .containsExactly(ConversionIssueType.UNATTACHED_INLINE_MODIFICATION);
    }

    @Test
    void block_amendment_replaces_absorbed_provisions() {
        List<Provision> input = provisions(
                "<p class=\"-3 11 0 left 1 0\">(2) Section 8 is amended by the insertion of the following after subsection (3):</p>",
                "<p class=\"-3 14 0 left 1 0\">“(4) The Minister shall publish a report annually.”</p>");

        AmendmentOutcome outcome = process(input);

        assertThat(outcome.provisions()).extracting(Provision::kind)
                .containsExactly(ProvisionKind.SUBSECTION, ProvisionKind.MOD_BLOCK);
        Provision block = outcome.provisions().get(1);
        assertThat(block.sequenceIndex()).isEqualTo(input.get(input.size() - 1).sequenceIndex());
        assertThat(block.content().selectFirst("quotedStructure > subsection").attr("eId"))
                .isEqualTo("sec_4_mod_1_qstr_subsect_4");
        assertThat(outcome.amendments()).hasSize(1);
    }

    @Test
    void unclosed_quotation_is_appended_at_the_end() {
        List<Provision> input = provisions(
                "<p class=\"0 0 0 left 1 0\">The Principal Act is amended by the substitution of the following for section 5:</p>",
                "<p class=\"-3 11 0 left 1 0\">“(1) never closed</p>");

        AmendmentOutcome outcome = process(input);

        assertThat(outcome.provisions()).extracting(Provision::kind).containsExactly(ProvisionKind.MOD_BLOCK);
        assertThat(issues.asList()).extracting(ConversionIssue::type)
                .containsExactly(ConversionIssueType.UNCLOSED_QUOTATION);
    }
}
