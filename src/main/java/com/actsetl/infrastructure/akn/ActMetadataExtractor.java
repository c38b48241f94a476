package com.actsetl.infrastructure.akn;

import com.actsetl.domain.act.model.ActMetadata;
import com.actsetl.infrastructure.eisb.EisbParseException;
import com.actsetl.infrastructure.eisb.normalize.ParagraphNormalizer;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Reads the act's number, year, short title, date of enactment and long title.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActMetadataExtractor {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("d MMMM, yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.BASIC_ISO_DATE
    );

    private final ParagraphNormalizer paragraphNormalizer;

    public ActMetadata extract(Element act) {
        Element metadata = XmlNodes.child(act, "metadata")
                .orElseThrow(() -> new EisbParseException("eISB document has no <metadata> element"));

        String shortTitle = childText(metadata, "title");
        log.info("Parsing metadata for: {}", shortTitle);
        int number = parseNumber(childText(metadata, "number"), "number");
        int year = parseNumber(childText(metadata, "year"), "year");
        LocalDate dateEnacted = parseDate(childText(metadata, "dateofenactment"));

        return new ActMetadata(number, year, dateEnacted, "enacted", shortTitle, longTitle(act));
    }

    LocalDate parseDate(String text) {
        if (text.isBlank()) {
            return null;
        }
        String cleaned = text.replaceAll("(\\d+)(st|nd|rd|th)", "$1").replace("[", "").replace("]", "").strip();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(cleaned, format);
            } catch (DateTimeParseException e) {
                log.trace("Date {} does not match {}", cleaned, format);
            }
        }
        log.warn("Unrecognised date of enactment: {}", text);
        return null;
    }

    private Element longTitle(Element act) {
        return XmlNodes.child(act, "frontmatter")
                .flatMap(frontmatter -> XmlNodes.children(frontmatter, "p").stream()
                        .filter(p -> p.text().contains("AN ACT TO") || p.text().contains("An Act to"))
                        .findFirst())
                .map(p -> paragraphNormalizer.normalize(p.clone()))
                .orElse(null);
    }

    private static int parseNumber(String text, String field) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new EisbParseException("Act " + field + " is not a number: '" + text + "'", e);
        }
    }

    private static String childText(Element parent, String name) {
        return XmlNodes.child(parent, name).map(Element::text).orElse("");
    }
}
