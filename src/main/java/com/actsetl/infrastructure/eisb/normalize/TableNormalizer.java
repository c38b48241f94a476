package com.actsetl.infrastructure.eisb.normalize;

import com.actsetl.domain.provision.model.Layout;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites an eISB table into the target table model. Column widths move from
 * {@code colgroup} into the table style and onto each cell; the first row becomes a header row.
 */
@Component
@RequiredArgsConstructor
public class TableNormalizer {

    private static final Set<String> KEPT_ATTRIBUTES = Set.of("style", "width");

    private final ParagraphNormalizer paragraphNormalizer;

    public Element normalize(Element table) {
        for (Element tbody : XmlNodes.children(table, "tbody")) {
            tbody.unwrap();
        }

        String style = Layout.parseDescriptor(table.attr("class")).map(Layout::toStyle).orElse("");
        List<String> columnWidths = new ArrayList<>();
        XmlNodes.child(table, "colgroup").ifPresent(colgroup -> {
            for (Element col : XmlNodes.children(colgroup, "col")) {
                columnWidths.add(stripPercent(col.attr("width")));
            }
            colgroup.remove();
        });
        style += ";colwidths:" + String.join(",", columnWidths);

        String width = stripPercent(table.attr("width"));
        for (Attribute attribute : new ArrayList<>(table.attributes().asList())) {
            if (!KEPT_ATTRIBUTES.contains(attribute.getKey())) {
                table.removeAttr(attribute.getKey());
            }
        }
        table.attr("style", style);
        if (!width.isEmpty()) {
            table.attr("width", width);
        }

        List<Element> rows = XmlNodes.children(table, "tr");
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            List<Element> cells = XmlNodes.children(rows.get(rowIndex), "td");
            for (int colIndex = 0; colIndex < cells.size(); colIndex++) {
                Element cell = cells.get(colIndex);
                String valign = cell.attr("valign");
                cell.removeAttr("valign");
                cell.tagName(rowIndex == 0 ? "th" : "td");
                String cellWidth = colIndex < columnWidths.size() ? columnWidths.get(colIndex) : "";
                cell.attr("style", "width:" + cellWidth + ";vertical-align:" + valign);
                paragraphNormalizer.normalizeChildren(cell);
            }
        }
        return table;
    }

    private static String stripPercent(String value) {
        return value == null ? "" : value.replace("%", "").strip();
    }
}
