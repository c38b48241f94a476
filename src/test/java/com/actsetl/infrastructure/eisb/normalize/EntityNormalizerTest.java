package com.actsetl.infrastructure.eisb.normalize;

import com.actsetl.infrastructure.xml.XmlFixtures;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityNormalizerTest {

    private EntityNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EntityNormalizer();
    }

    @Test
    @DisplayName("Quotes and accented capitals become characters in one text run")
    void replaces_entities() {
        Element paragraph = XmlFixtures.element("<p><odq/>Minister<cdq/> and <Afada/>ras</p>");

        int replaced = normalizer.normalize(paragraph);

        assertThat(replaced).isEqualTo(3);
        assertThat(paragraph.text()).isEqualTo("“Minister” and Áras");
        assertThat(paragraph.childNodeSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Entities nested in inline markup are replaced too")
    void nested_entities() {
        Element paragraph = XmlFixtures.element("<p><b><odq/>5.</b> costs <euro/>100</p>");

        normalizer.normalize(paragraph);

        assertThat(paragraph.selectFirst("b").text()).isEqualTo("“5.");
        assertThat(paragraph.text()).isEqualTo("“5. costs €100");
    }

    @Test
    @DisplayName("Unknown empty elements are left alone")
    void unknown_elements() {
        Element paragraph = XmlFixtures.element("<p>before<br/>after</p>");

        assertThat(normalizer.normalize(paragraph)).isZero();
        assertThat(paragraph.selectFirst("br")).isNotNull();
    }
}
