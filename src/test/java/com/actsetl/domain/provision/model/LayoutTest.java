package com.actsetl.domain.provision.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LayoutTest {

    @Test
    @DisplayName("Six-token descriptor gives hanging indent, margin and alignment")
    void parses_descriptor() {
        Layout layout = Layout.parse("-3 11 0 left 1 0");
        assertThat(layout).isEqualTo(new Layout(-3, 11, "left"));
        assertThat(layout.indent()).isEqualTo(8);
        assertThat(layout.isCentered()).isFalse();
    }

    @Test
    @DisplayName("Malformed descriptors fall back to the default layout")
    void malformed_descriptor() {
        assertThat(Layout.parse(null)).isEqualTo(Layout.DEFAULT);
        assertThat(Layout.parse("")).isEqualTo(Layout.DEFAULT);
        assertThat(Layout.parse("0 0 left")).isEqualTo(Layout.DEFAULT);
        assertThat(Layout.parse("x 0 0 left 1 0")).isEqualTo(Layout.DEFAULT);
        assertThat(Layout.parseDescriptor("x 0 0 left 1 0")).isEmpty();
    }

    @Test
    @DisplayName("Style halves the layout units")
    void style() {
        assertThat(Layout.parse("-3 11 0 left 1 0").toStyle())
                .isEqualTo("text-indent:-1.5;margin-left:5.5;text-align:left");
        assertThat(Layout.parse("0 14 0 center 1 0").toStyle())
                .isEqualTo("text-indent:0;margin-left:7;text-align:center");
    }
}
