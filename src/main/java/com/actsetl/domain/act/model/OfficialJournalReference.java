package com.actsetl.domain.act.model;

/**
 * A citation of the Official Journal of the European Union.
 *
 * @param series C or L
 * @param number issue number
 * @param year   year of publication
 * @param page   first page
 */
public record OfficialJournalReference(String series, int number, int year, int page) {

    private static final String EUR_LEX_PREFIX = "https://eur-lex.europa.eu/legal-content/EN/TXT/?uri=";

    public String toEurLexUri() {
        return EUR_LEX_PREFIX + String.format("uriserv:OJ.%s_.%d.%03d.01.%04d.01.ENG", series, year, number, page);
    }
}
