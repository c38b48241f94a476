package com.actsetl.infrastructure.pipeline;

import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.act.model.EditorialNote;
import com.actsetl.domain.amendment.model.AmendmentKind;
import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.conversion.model.ConversionIssue;
import com.actsetl.domain.conversion.model.ConversionIssueType;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.infrastructure.akn.ActMetadataExtractor;
import com.actsetl.infrastructure.akn.ActiveModificationsBuilder;
import com.actsetl.infrastructure.akn.AknSkeletonBuilder;
import com.actsetl.infrastructure.akn.AknWriter;
import com.actsetl.infrastructure.akn.EditorialNotesBuilder;
import com.actsetl.infrastructure.akn.TocBuilder;
import com.actsetl.infrastructure.eisb.BodyParser;
import com.actsetl.infrastructure.eisb.EisbParseException;
import com.actsetl.infrastructure.eisb.ScheduleParser;
import com.actsetl.infrastructure.eisb.SectionParser;
import com.actsetl.infrastructure.eisb.amendment.AmendmentProcessor;
import com.actsetl.infrastructure.eisb.amendment.AmendmentStateMachineFactory;
import com.actsetl.infrastructure.eisb.hierarchy.HeadingRepairer;
import com.actsetl.infrastructure.eisb.hierarchy.HierarchyBuilder;
import com.actsetl.infrastructure.eisb.normalize.EntityNormalizer;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.normalize.TableNormalizer;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.eisb.provision.ProvisionClassifier;
import com.actsetl.infrastructure.xml.XmlFixtures;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionPipelineTest {

    private ConversionPipeline pipeline;

    @BeforeEach
    void setUp() {
        PatternLibrary patterns = new PatternLibrary();
        ParagraphNormalizer paragraphs = new ParagraphNormalizer(patterns);
        TableNormalizer tables = new TableNormalizer(paragraphs);
        ProvisionClassifier classifier = new ProvisionClassifier(patterns, paragraphs, tables);
        HierarchyBuilder hierarchy = new HierarchyBuilder();
        AmendmentStateMachineFactory factory = new AmendmentStateMachineFactory(patterns, hierarchy, "#principal_act");
        SectionParser sectionParser = new SectionParser(classifier, paragraphs, factory, new AmendmentProcessor());

        pipeline = new ConversionPipeline(
                new EntityNormalizer(),
                new ActMetadataExtractor(paragraphs),
                new AknSkeletonBuilder("https://www.data.oireachtas.ie", "Houses of the Oireachtas"),
                new BodyParser(sectionParser, hierarchy, paragraphs),
                new ScheduleParser(paragraphs, tables),
                new HeadingRepairer(),
                new TocBuilder(),
                new ActiveModificationsBuilder(),
                new EditorialNotesBuilder(),
                new AknWriter(false)
        );
    }

    @Nested
    @DisplayName("Sample act end to end")
    class SampleAct {

        private ConversionResult result;
        private Document akn;

        @BeforeEach
        void convert() {
            result = pipeline.execute(XmlFixtures.resource("/eisb/sample-act.xml"));
            akn = XmlFixtures.document(result.aknXml());
        }

        @Test
        void serializes_akoma_ntoso_document() {
            assertThat(result.aknXml()).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
            Element root = akn.selectFirst("akomaNtoso");
            assertThat(root).isNotNull();
            assertThat(root.attr("xmlns")).isEqualTo(AknSkeletonBuilder.AKN_NAMESPACE);
            assertThat(akn.selectFirst("FRBRWork > FRBRthis").attr("value")).isEqualTo("/eli/ie/oireachtas/2024/act/12");
            assertThat(akn.selectFirst("preface docNumber").text()).isEqualTo("Number 12 of 2024");
        }

        @Test
        void body_holds_divisions_sections_and_schedule() {
            Element body = akn.selectFirst("act > body");
            assertThat(body.children()).extracting(e -> e.attr("eId"))
                    .containsExactly("part_1", "part_2", "sched_1");
            assertThat(body.selectFirst("section[eId=sec_2] > subsection[eId=sec_2_subsect_1]")).isNotNull();
            assertThat(body.text()).contains("“Principal Act” means the Financial Services Act 2010;");
        }

        @Test
        void inserted_part_heading_is_repaired() {
            Element part = akn.selectFirst("quotedStructure > part[eId=sec_6_mod_1_qstr_part_3]");
            assertThat(part.children()).extracting(Element::tagName)
                    .containsExactly("num", "heading", "section");
            assertThat(part.selectFirst("heading").text()).isEqualTo("Supervision");
            assertThat(part.selectFirst("section").text()).endsWith("compliance with this Part.");
        }

        @Test
        void quotation_marks_move_to_quoted_structure() {
            Element quoted = akn.selectFirst("quotedStructure[eId=sec_3_mod_1_qstr]");
            assertThat(quoted.attr("startQuote")).isEqualTo("“");
            assertThat(quoted.attr("endQuote")).isEqualTo("”.");
            assertThat(quoted.text()).doesNotContain("“").doesNotContain("”");
        }

        @Test
        void active_modifications_match_amendments() {
            assertThat(result.amendments()).extracting(AmendmentMetadata::kind).containsExactly(
                    AmendmentKind.SUBSTITUTION, AmendmentKind.SUBSTITUTION,
                    AmendmentKind.INSERTION, AmendmentKind.INSERTION);
            assertThat(akn.select("analysis > activeModifications > textualMod")).hasSize(4);
            assertThat(akn.select("textualMod > source")).extracting(e -> e.attr("href"))
                    .containsExactly("#sec_3_mod_1", "#sec_4_mod_1", "#sec_4_mod_2", "#sec_6_mod_1");
            for (AmendmentMetadata amendment : result.amendments()) {
                String modEid = amendment.sourceReference().substring(1);
                assertThat(akn.selectFirst("mod[eId=" + modEid + "]")).isNotNull();
            }
        }

        @Test
        void table_of_contents_lists_top_level_structure() {
            assertThat(akn.select("coverPage > toc > tocItem")).extracting(e -> e.attr("href")).containsExactly(
                    "#part_1", "#sec_1", "#sec_2",
                    "#part_2", "#part_2_chapter_1", "#sec_3", "#sec_4", "#sec_5", "#sec_6",
                    "#sched_1");
        }

        @Test
        void broken_section_is_reported_as_error() {
            assertThat(result.hasErrors()).isTrue();
            assertThat(result.issues()).extracting(ConversionIssue::type)
                    .containsExactly(ConversionIssueType.MISSING_SECTION_ANCHOR);
        }
    }

    @Test
    @DisplayName("Same input converts to the same document")
    void deterministic() {
        String source = XmlFixtures.resource("/eisb/sample-act.xml");

        assertThat(pipeline.execute(source).aknXml()).isEqualTo(pipeline.execute(source).aknXml());
    }

    @Test
    @DisplayName("Editorial notes for the act are added to the metadata")
    void editorial_notes() {
        List<ActNotes> notes = List.of(new ActNotes("/eli/ie/oireachtas/2024/act/12",
                List.of(new EditorialNote("sec_2", "Definitions apply to Part 2 only.", "editorial"))));

        ConversionResult result = pipeline.execute(XmlFixtures.resource("/eisb/sample-act.xml"), notes);

        Document akn = XmlFixtures.document(result.aknXml());
        assertThat(akn.selectFirst("meta > notes > note").attr("eId")).isEqualTo("note-sec_2");
        assertThat(akn.selectFirst("section[eId=sec_2] > num > noteRef").attr("href")).isEqualTo("#note-sec_2");
        assertThat(akn.select("noteRef")).hasSize(1);
        assertThat(result.issues()).extracting(ConversionIssue::type)
                .containsExactly(ConversionIssueType.MISSING_SECTION_ANCHOR);
    }

    @Test
    void act_without_amendments_has_no_analysis() {
        ConversionResult result = pipeline.execute("""
                <act><metadata><title>Short Act 2020</title><number>1</number><year>2020</year></metadata>
                <body><sect><number>1</number><title><p class="0 0 0 left 0 0">Short title</p></title>
                <p class="0 0 0 left 1 0">This Act may be cited as the Short Act 2020.</p></sect></body></act>
                """);

        Document akn = XmlFixtures.document(result.aknXml());
        assertThat(akn.selectFirst("meta > analysis")).isNull();
        assertThat(akn.selectFirst("section[eId=sec_1] > content > p").text())
                .isEqualTo("This Act may be cited as the Short Act 2020.");
        assertThat(result.issues()).isEmpty();
    }

    @Nested
    @DisplayName("Rejected documents")
    class Rejections {
        @Test
        void empty_input() {
            assertThatThrownBy(() -> pipeline.execute("  "))
                    .isInstanceOf(EisbParseException.class);
        }

        @Test
        void not_an_act() {
            assertThatThrownBy(() -> pipeline.execute("<bill><body/></bill>"))
                    .isInstanceOf(EisbParseException.class)
                    .hasMessageContaining("<act>");
        }

        @Test
        void act_without_body() {
            assertThatThrownBy(() -> pipeline.execute(
                    "<act><metadata><title>T</title><number>1</number><year>2020</year></metadata></act>"))
                    .isInstanceOf(EisbParseException.class)
                    .hasMessageContaining("<body>");
        }
    }
}
