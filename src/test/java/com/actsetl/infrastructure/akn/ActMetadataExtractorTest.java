package com.actsetl.infrastructure.akn;

import com.actsetl.domain.act.model.ActMetadata;
import com.actsetl.infrastructure.eisb.EisbParseException;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.eisb.pattern.PatternLibrary;
import com.actsetl.infrastructure.xml.XmlFixtures;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActMetadataExtractorTest {

    private ActMetadataExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ActMetadataExtractor(new ParagraphNormalizer(new PatternLibrary()));
    }

    @Test
    @DisplayName("Reads number, year, date, short title and long title")
    void reads_sample_act() {
        Element act = XmlFixtures.document(XmlFixtures.resource("/eisb/sample-act.xml")).selectFirst("act");

        ActMetadata metadata = extractor.extract(act);

        assertThat(metadata.number()).isEqualTo(12);
        assertThat(metadata.year()).isEqualTo(2024);
        assertThat(metadata.dateEnacted()).isEqualTo(LocalDate.of(2024, 3, 12));
        assertThat(metadata.shortTitle()).isEqualTo("Financial Services (Amendment) Act 2024");
        assertThat(metadata.longTitle().text()).startsWith("AN ACT TO AMEND");
        assertThat(metadata.longTitle().hasAttr("style")).isTrue();
        assertThat(metadata.workUri()).isEqualTo("/eli/ie/oireachtas/2024/act/12");
        assertThat(metadata.expressionUri()).isEqualTo("/eli/ie/oireachtas/2024/act/12/enacted/en");
        assertThat(metadata.displayNumber()).isEqualTo("Number 12 of 2024");
    }

    @Test
    @DisplayName("Source front matter is left untouched")
    void long_title_is_a_copy() {
        Element act = XmlFixtures.document(XmlFixtures.resource("/eisb/sample-act.xml")).selectFirst("act");

        extractor.extract(act);

        assertThat(act.selectFirst("frontmatter > p").attr("class")).isEqualTo("0 0 0 left 0 0");
    }

    @Test
    void act_without_long_title() {
        Element act = XmlFixtures.element(
                "<act><metadata><title>Short Act 2020</title><number>1</number><year>2020</year></metadata></act>");

        ActMetadata metadata = extractor.extract(act);

        assertThat(metadata.longTitle()).isNull();
        assertThat(metadata.dateEnacted()).isNull();
    }

    @Nested
    @DisplayName("Rejected documents")
    class Rejections {
        @Test
        void missing_metadata() {
            assertThatThrownBy(() -> extractor.extract(XmlFixtures.element("<act><body/></act>")))
                    .isInstanceOf(EisbParseException.class)
                    .hasMessageContaining("<metadata>");
        }

        @Test
        void non_numeric_number() {
            Element act = XmlFixtures.element(
                    "<act><metadata><title>T</title><number>XII</number><year>2020</year></metadata></act>");

            assertThatThrownBy(() -> extractor.extract(act))
                    .isInstanceOf(EisbParseException.class)
                    .hasMessageContaining("number");
        }
    }

    @Nested
    @DisplayName("Dates of enactment")
    class Dates {
        @Test
        void accepted_formats() {
            LocalDate expected = LocalDate.of(2024, 3, 12);
            assertThat(extractor.parseDate("2024-03-12")).isEqualTo(expected);
            assertThat(extractor.parseDate("12 March 2024")).isEqualTo(expected);
            assertThat(extractor.parseDate("12th March, 2024")).isEqualTo(expected);
            assertThat(extractor.parseDate("[12th March, 2024]")).isEqualTo(expected);
            assertThat(extractor.parseDate("12/03/2024")).isEqualTo(expected);
        }

        @Test
        void unrecognised_date_is_absent() {
            assertThat(extractor.parseDate("sometime in spring")).isNull();
            assertThat(extractor.parseDate("")).isNull();
        }
    }
}
