package com.actsetl.infrastructure.akn;

import com.actsetl.domain.act.model.ActMetadata;
import com.actsetl.infrastructure.xml.XmlNodes;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds the empty Akoma Ntoso act: FRBR identification, analysis and references metadata,
 * cover page, preface and an empty body.
 */
@Component
public class AknSkeletonBuilder {

    public static final String AKN_NAMESPACE = "http://docs.oasis-open.org/legaldocml/ns/akn/3.0";
    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    static final String SCHEMA_LOCATION = AKN_NAMESPACE
            + " http://docs.oasis-open.org/legaldocml/akn-core/v1.0/cos01/part2-specs/schemas/akomantoso30.xsd";

    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM, yyyy", Locale.ENGLISH);

    private final String publisherHref;
    private final String publisherName;
    private final Clock clock;

    public AknSkeletonBuilder(@Value("${actsetl.publisher.href:https://www.data.oireachtas.ie}") String publisherHref,
                              @Value("${actsetl.publisher.show-as:Houses of the Oireachtas}") String publisherName) {
        this(publisherHref, publisherName, Clock.systemDefaultZone());
    }

    AknSkeletonBuilder(String publisherHref, String publisherName, Clock clock) {
        this.publisherHref = publisherHref;
        this.publisherName = publisherName;
        this.clock = clock;
    }

    /**
     * The {@code akomaNtoso} root holding the act skeleton.
     */
    public Element build(ActMetadata metadata) {
        Element root = XmlNodes.element("akomaNtoso");
        XmlNodes.attr(root, "xmlns", AKN_NAMESPACE);
        XmlNodes.attr(root, "xmlns:xsi", XSI_NAMESPACE);
        XmlNodes.attr(root, "xsi:schemaLocation", SCHEMA_LOCATION);

        Element act = XmlNodes.element("act");
        act.attr("name", "ActOfTheOireachtas");
        act.appendChild(meta(metadata));
        act.appendChild(coverPage(metadata));
        act.appendChild(preface(metadata));
        act.appendChild(XmlNodes.element("body"));
        root.appendChild(act);
        return root;
    }

    private Element meta(ActMetadata metadata) {
        String enacted = metadata.dateEnacted() != null ? metadata.dateEnacted().toString() : "";

        Element work = XmlNodes.element("FRBRWork");
        work.appendChild(valued("FRBRthis", metadata.workUri()));
        XmlNodes.attr(work.children().last(), "showAs", metadata.shortTitle());
        work.appendChild(valued("FRBRuri", metadata.workUri()));
        work.appendChild(dated("FRBRdate", enacted, "enacted"));
        work.appendChild(author());
        work.appendChild(valued("FRBRcountry", "ie"));
        work.appendChild(valued("FRBRnumber", Integer.toString(metadata.number())));
        work.appendChild(valued("FRBRname", metadata.shortTitle()));

        Element expression = XmlNodes.element("FRBRExpression");
        expression.appendChild(valued("FRBRthis", metadata.expressionUri()));
        expression.appendChild(valued("FRBRuri", metadata.expressionUri()));
        expression.appendChild(dated("FRBRdate", enacted, "enacted"));
        expression.appendChild(author());
        expression.appendChild(valued("FRBRauthoritative", "true"));
        Element language = XmlNodes.element("FRBRlanguage");
        language.attr("language", "eng");
        expression.appendChild(language);

        Element manifestation = XmlNodes.element("FRBRManifestation");
        manifestation.appendChild(valued("FRBRthis", metadata.manifestationUri()));
        manifestation.appendChild(valued("FRBRuri", metadata.manifestationUri()));
        manifestation.appendChild(dated("FRBRdate", LocalDate.now(clock).toString(), "transformed"));
        manifestation.appendChild(author());
        manifestation.appendChild(valued("FRBRformat", "application/akn+xml"));

        Element identification = XmlNodes.element("identification");
        identification.attr("source", "#source");
        identification.appendChild(work);
        identification.appendChild(expression);
        identification.appendChild(manifestation);

        Element analysis = XmlNodes.element("analysis");
        analysis.attr("source", "#source");
        analysis.appendChild(XmlNodes.element("activeModifications"));

        Element organization = XmlNodes.element("TLCOrganization");
        XmlNodes.attr(organization, "eId", "source");
        organization.attr("href", publisherHref);
        XmlNodes.attr(organization, "showAs", publisherName);
        Element references = XmlNodes.element("references");
        references.attr("source", "#source");
        references.appendChild(organization);

        Element meta = XmlNodes.element("meta");
        meta.appendChild(identification);
        meta.appendChild(analysis);
        meta.appendChild(references);
        return meta;
    }

    private Element coverPage(ActMetadata metadata) {
        Element coverPage = XmlNodes.element("coverPage");
        coverPage.appendChild(number(metadata));
        coverPage.appendChild(shortTitle(metadata));
        coverPage.appendChild(XmlNodes.element("p", "CONTENTS"));
        coverPage.appendChild(XmlNodes.element("toc"));
        return coverPage;
    }

    private Element preface(ActMetadata metadata) {
        Element preface = XmlNodes.element("preface");
        preface.appendChild(number(metadata));
        preface.appendChild(shortTitle(metadata));
        if (metadata.longTitle() != null) {
            Element longTitle = XmlNodes.element("longTitle");
            longTitle.appendChild(metadata.longTitle().clone());
            preface.appendChild(longTitle);
        }
        if (metadata.dateEnacted() != null) {
            Element docDate = XmlNodes.element("docDate", "[" + dateOfEnactment(metadata.dateEnacted()) + "]");
            docDate.attr("date", metadata.dateEnacted().toString());
            Element paragraph = XmlNodes.element("p");
            paragraph.attr("class", "DateOfEnactment");
            paragraph.attr("style", "text-indent:0;margin-left:4;text-align:right");
            paragraph.appendChild(docDate);
            preface.appendChild(paragraph);
        }
        Element formula = XmlNodes.element("formula");
        formula.attr("name", "EnactingText");
        formula.appendChild(XmlNodes.element("p", "Be it enacted by the Oireachtas as follows:"));
        preface.appendChild(formula);
        return preface;
    }

    private Element number(ActMetadata metadata) {
        Element docNumber = XmlNodes.element("docNumber", metadata.displayNumber());
        Element paragraph = XmlNodes.element("p");
        paragraph.attr("class", "Number");
        paragraph.appendChild(docNumber);
        return paragraph;
    }

    private Element shortTitle(ActMetadata metadata) {
        Element paragraph = XmlNodes.element("p");
        paragraph.attr("class", "shortTitle");
        paragraph.appendChild(XmlNodes.element("shortTitle", metadata.shortTitle()));
        return paragraph;
    }

    /**
     * "12th March, 2024".
     */
    static String dateOfEnactment(LocalDate date) {
        return ordinal(date.getDayOfMonth()) + " " + date.format(MONTH_YEAR);
    }

    static String ordinal(int day) {
        if ((day >= 4 && day <= 20) || (day >= 24 && day <= 30)) {
            return day + "th";
        }
        return day + new String[]{"st", "nd", "rd"}[day % 10 - 1];
    }

    private static Element valued(String name, String value) {
        Element element = XmlNodes.element(name);
        element.attr("value", value);
        return element;
    }

    private static Element dated(String name, String date, String label) {
        Element element = XmlNodes.element(name);
        element.attr("date", date);
        element.attr("name", label);
        return element;
    }

    private static Element author() {
        Element element = XmlNodes.element("FRBRauthor");
        element.attr("href", "#source");
        return element;
    }
}
