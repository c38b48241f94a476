package com.actsetl.domain.act.model;

import org.jsoup.nodes.Element;

import java.time.LocalDate;

/**
 * Identifying details of an Act, read from the eISB metadata and front matter.
 *
 * @param number      act number within the year
 * @param year        year of enactment
 * @param dateEnacted date the act was signed, nullable
 * @param status      publication status, "enacted" for source documents
 * @param shortTitle  the act's short title
 * @param longTitle   the long title paragraph, nullable
 */
public record ActMetadata(
        int number,
        int year,
        LocalDate dateEnacted,
        String status,
        String shortTitle,
        Element longTitle
) {

    public String workUri() {
        return "/eli/ie/oireachtas/" + year + "/act/" + number;
    }

    public String expressionUri() {
        return workUri() + "/" + status + "/en";
    }

    public String manifestationUri() {
        return expressionUri() + "/akn";
    }

    public String displayNumber() {
        return "Number " + number + " of " + year;
    }
}
