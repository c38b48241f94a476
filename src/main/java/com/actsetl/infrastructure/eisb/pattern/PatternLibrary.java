package com.actsetl.infrastructure.eisb.pattern;

import com.actsetl.domain.act.model.OfficialJournalReference;
import com.actsetl.domain.amendment.model.AmendmentInstruction;
import com.actsetl.domain.amendment.model.AmendmentKind;
import com.actsetl.domain.amendment.model.AmendmentPosition;
import com.actsetl.domain.amendment.model.DestinationComponent;
import com.actsetl.domain.provision.model.MarkerMatch;
import com.actsetl.domain.provision.model.ProvisionKind;
import com.actsetl.domain.provision.model.StructuralLabel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regular expressions for the drafting conventions of Irish primary legislation:
 * structural markers, amending phrases, amended locations, quotation marks and
 * Official Journal citations.
 *
 * Marker and amendment patterns are tried in priority order; the first match wins.
 */
@Component
public class PatternLibrary {

    public static final String OPEN_DOUBLE_QUOTE = "“";
    public static final String CLOSE_DOUBLE_QUOTE = "”";
    public static final String OPEN_SINGLE_QUOTE = "‘";
    public static final String CLOSE_SINGLE_QUOTE = "’";

    private static final String QUOTES = "[\"'“”‘’]{1,2}";
    // Quoted text may hold apostrophes ("Minister’s"); only double quotes end it.
    private static final String UNQUOTED = "([^\"“”]+)";

    private record MarkerPattern(Pattern pattern, ProvisionKind kind) {}

    private record InstructionPattern(Pattern pattern, Function<Matcher, AmendmentInstruction> factory) {}

    /**
     * Marker patterns in priority order. Roman capitals are tried before other capitals,
     * so "(IV)" is a clause and "(B)" a subclause.
     */
    private static final List<MarkerPattern> MARKER_PATTERNS = List.of(
            // 1. Subsection: (1), (1A), “(2)
            new MarkerPattern(Pattern.compile("^\\s?([“”]?\\(\\d+[A-Z]*\\))"), ProvisionKind.SUBSECTION),
            // 2. Paragraph or subparagraph: (a), (iv)
            new MarkerPattern(Pattern.compile("^\\s?([“”]?\\([a-z]+\\))"), ProvisionKind.PARAGRAPH),
            // 3. Clause: (I), (IV)
            new MarkerPattern(Pattern.compile("^\\s?([“”]?\\([IVX]+\\))"), ProvisionKind.CLAUSE),
            // 4. Subclause: (A), (B)
            new MarkerPattern(Pattern.compile("^\\s?([“”]?\\([A-Z]+\\))"), ProvisionKind.SUBCLAUSE)
    );

    /**
     * Amending phrases in priority order. The inline form must come first: it is a
     * special case of the general substitution phrase.
     */
    private static final List<InstructionPattern> INSTRUCTION_PATTERNS = List.of(
            // 1. Inline substitution: by the substitution of “new” for “old”
            new InstructionPattern(
                    Pattern.compile("by the substitution of " + QUOTES + UNQUOTED + QUOTES
                            + " for " + QUOTES + UNQUOTED + QUOTES, Pattern.CASE_INSENSITIVE),
                    m -> AmendmentInstruction.inlineSubstitution(m.group(1), m.group(2))
            ),
            // 2. Block substitution: by the substitution of the following for section 5:
            new InstructionPattern(
                    Pattern.compile("by the substitution of .* for (?<destination>.+)", Pattern.CASE_INSENSITIVE),
                    m -> AmendmentInstruction.block(AmendmentKind.SUBSTITUTION,
                            cleanDestination(m.group("destination")), null)
            ),
            // 3. Insertion after a location
            new InstructionPattern(
                    Pattern.compile("by the insertion of .* after (?<destination>.+)", Pattern.CASE_INSENSITIVE),
                    m -> AmendmentInstruction.block(AmendmentKind.INSERTION,
                            cleanDestination(m.group("destination")), AmendmentPosition.AFTER)
            ),
            // 4. Insertion before a location
            new InstructionPattern(
                    Pattern.compile("by the insertion of .* before (?<destination>.+)", Pattern.CASE_INSENSITIVE),
                    m -> AmendmentInstruction.block(AmendmentKind.INSERTION,
                            cleanDestination(m.group("destination")), AmendmentPosition.BEFORE)
            ),
            // 5. Insertion of definitions, no location named
            new InstructionPattern(
                    Pattern.compile("by the insertion of the following definitions:", Pattern.CASE_INSENSITIVE),
                    m -> AmendmentInstruction.block(AmendmentKind.INSERTION, "", null)
            )
    );

    private static final Pattern DESTINATION_COMPONENT =
            Pattern.compile("(section|subsect|paragraph) \\(?(\\w+)\\)?");

    private static final Pattern QUOTATION_CLOSE =
            Pattern.compile(CLOSE_DOUBLE_QUOTE + "[.,;:]?$");

    private static final Pattern STRUCTURAL_LABEL =
            Pattern.compile("^" + OPEN_DOUBLE_QUOTE + "?(PART|CHAPTER|SCHEDULE|ARTICLE)(?:\\s+([0-9A-Z]+))?$");

    private static final Pattern OFFICIAL_JOURNAL =
            Pattern.compile("OJ(No)?(?<series>[CL])(?<number>\\d+),\\d+(?<year>\\d{4}),?p(?<page>\\d+)");

    /**
     * Matches a structural marker at the start of {@code text}.
     */
    public Optional<MarkerMatch> matchMarker(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (MarkerPattern entry : MARKER_PATTERNS) {
            Matcher matcher = entry.pattern().matcher(text);
            if (matcher.find()) {
                String remainder = text.substring(matcher.end()).stripLeading();
                return Optional.of(new MarkerMatch(entry.kind(), matcher.group(1), remainder));
            }
        }
        return Optional.empty();
    }

    /**
     * Recognises an amending phrase anywhere in {@code text}.
     */
    public Optional<AmendmentInstruction> matchInstruction(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (InstructionPattern entry : INSTRUCTION_PATTERNS) {
            Matcher matcher = entry.pattern().matcher(text);
            if (matcher.find()) {
                return Optional.of(entry.factory().apply(matcher));
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the section / subsection / paragraph components of an amended location,
     * outermost first. "subsection" is shortened to "subsect".
     */
    public List<DestinationComponent> parseDestination(String text) {
        List<DestinationComponent> components = new ArrayList<>();
        if (text == null) {
            return components;
        }
        String normalized = text.toLowerCase(Locale.ROOT).replace("subsection", "subsect");
        Matcher matcher = DESTINATION_COMPONENT.matcher(normalized);
        while (matcher.find()) {
            components.add(new DestinationComponent(matcher.group(1), matcher.group(2)));
        }
        return components;
    }

    /**
     * A paragraph opens a quotation when it is a bare opening quote, or starts with
     * one and contains no other.
     */
    public boolean opensQuotation(String text) {
        if (text == null || !text.startsWith(OPEN_DOUBLE_QUOTE)) {
            return false;
        }
        return text.equals(OPEN_DOUBLE_QUOTE) || text.indexOf(OPEN_DOUBLE_QUOTE, 1) < 0;
    }

    /**
     * A paragraph closes a quotation when it ends with a closing quote (optionally followed
     * by one punctuation mark) that has no opening quote of its own in the paragraph, or when
     * it both opens and closes a single quotation.
     */
    public boolean closesQuotation(String text) {
        if (text == null || !QUOTATION_CLOSE.matcher(text).find()) {
            return false;
        }
        long opening = count(text, OPEN_DOUBLE_QUOTE);
        long closing = count(text, CLOSE_DOUBLE_QUOTE);
        if (closing > opening) {
            return true;
        }
        return opening == 1 && closing == 1 && text.startsWith(OPEN_DOUBLE_QUOTE);
    }

    /**
     * The closing quote and any punctuation following it, or an empty string.
     */
    public String closingQuote(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = QUOTATION_CLOSE.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    /**
     * Matches a stand-alone label such as {@code PART 3} or {@code SCHEDULE}.
     */
    public Optional<StructuralLabel> matchStructuralLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = STRUCTURAL_LABEL.matcher(text.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        ProvisionKind kind = switch (matcher.group(1)) {
            case "PART" -> ProvisionKind.PART;
            case "CHAPTER" -> ProvisionKind.CHAPTER;
            case "SCHEDULE" -> ProvisionKind.SCHEDULE;
            default -> ProvisionKind.ARTICLE;
        };
        String label = text.strip().replaceFirst("^" + OPEN_DOUBLE_QUOTE, "");
        String number = matcher.group(2) != null ? matcher.group(2) : "";
        return Optional.of(new StructuralLabel(kind, label, number));
    }

    /**
     * Parses an Official Journal citation such as "OJ No. L 150, 1.2.2020, p. 5".
     */
    public Optional<OfficialJournalReference> matchOfficialJournal(String citation) {
        if (citation == null) {
            return Optional.empty();
        }
        String compact = citation.replace(".", "").replace(" ", "");
        Matcher matcher = OFFICIAL_JOURNAL.matcher(compact);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new OfficialJournalReference(
                matcher.group("series"),
                Integer.parseInt(matcher.group("number")),
                Integer.parseInt(matcher.group("year")),
                Integer.parseInt(matcher.group("page"))));
    }

    private static String cleanDestination(String destination) {
        return destination.replaceAll("^[:\\s]+|[:\\s]+$", "");
    }

    private static long count(String text, String quote) {
        return text.chars().filter(c -> c == quote.charAt(0)).count();
    }
}
