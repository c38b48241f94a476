package com.actsetl.infrastructure.akn;

import com.actsetl.domain.act.model.ActMetadata;
import com.actsetl.domain.amendment.model.AmendmentKind;
import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.amendment.model.AmendmentPosition;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActiveModificationsBuilderTest {

    private static final List<AmendmentMetadata> AMENDMENTS = List.of(
            new AmendmentMetadata(AmendmentKind.SUBSTITUTION, "#sec_4_mod_1", "#principal_act/section_7",
                    null, "€100", "€500"),
            new AmendmentMetadata(AmendmentKind.INSERTION, "#sec_4_mod_2", "#principal_act/subsect_3",
                    AmendmentPosition.AFTER, null, null));

    private ActiveModificationsBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ActiveModificationsBuilder();
    }

    @Test
    void one_textual_mod_per_amendment() {
        Element block = builder.buildActiveModifications(AMENDMENTS);

        assertThat(block.tagName()).isEqualTo("activeModifications");
        assertThat(block.children()).hasSize(2);

        Element substitution = block.child(0);
        assertThat(substitution.attr("type")).isEqualTo("substitution");
        assertThat(substitution.selectFirst("source").attr("href")).isEqualTo("#sec_4_mod_1");
        assertThat(substitution.selectFirst("destination").attr("href")).isEqualTo("#principal_act/section_7");
        assertThat(substitution.selectFirst("destination").hasAttr("pos")).isFalse();
        assertThat(substitution.selectFirst("old").text()).isEqualTo("€100");
        assertThat(substitution.selectFirst("new").text()).isEqualTo("€500");

        Element insertion = block.child(1);
        assertThat(insertion.attr("type")).isEqualTo("insertion");
        assertThat(insertion.selectFirst("destination").attr("pos")).isEqualTo("after");
        assertThat(insertion.selectFirst("old")).isNull();
    }

    @Test
    void apply_replaces_skeleton_block() {
        Element root = skeleton();

        builder.apply(root.selectFirst("act"), AMENDMENTS);

        assertThat(root.select("analysis > activeModifications")).hasSize(1);
        assertThat(root.select("analysis > activeModifications > textualMod")).hasSize(2);
    }

    @Test
    void apply_without_amendments_drops_empty_analysis() {
        Element root = skeleton();

        builder.apply(root.selectFirst("act"), List.of());

        assertThat(root.selectFirst("meta > analysis")).isNull();
        assertThat(root.selectFirst("meta > references")).isNotNull();
    }

    private static Element skeleton() {
        return new AknSkeletonBuilder("https://www.data.oireachtas.ie", "Houses of the Oireachtas")
                .build(new ActMetadata(1, 2020, null, "enacted", "Short Act 2020", null));
    }
}
