package com.actsetl.infrastructure.akn;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.XmlDeclaration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Serializes the finished document as UTF-8 XML.
 */
@Slf4j
@Component
public class AknWriter {

    private final boolean removeStyles;

    public AknWriter(@Value("${actsetl.output.remove-styles:false}") boolean removeStyles) {
        this.removeStyles = removeStyles;
    }

    public String write(Element root) {
        if (removeStyles) {
            popStyles(root);
        }
        Document document = new Document("");
        document.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset("UTF-8")
                .prettyPrint(true)
                .indentAmount(2);
        XmlDeclaration declaration = new XmlDeclaration("xml", false);
        declaration.attr("version", "1.0");
        declaration.attr("encoding", "UTF-8");
        document.appendChild(declaration);
        document.appendChild(root);
        return document.outerHtml();
    }

    /**
     * Removes every {@code style} attribute.
     */
    public int popStyles(Element root) {
        log.info("Removing style attributes");
        int removed = 0;
        for (Element element : root.select("[style]")) {
            element.removeAttr("style");
            removed++;
        }
        return removed;
    }
}
