package com.actsetl.infrastructure.pipeline;

import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.infrastructure.akn.ActMetadataExtractor;
import com.actsetl.infrastructure.akn.ActiveModificationsBuilder;
import com.actsetl.infrastructure.akn.AknSkeletonBuilder;
import com.actsetl.infrastructure.akn.AknWriter;
import com.actsetl.infrastructure.akn.EditorialNotesBuilder;
import com.actsetl.infrastructure.akn.TocBuilder;
import com.actsetl.infrastructure.eisb.BodyParseResult;
import com.actsetl.infrastructure.eisb.BodyParser;
import com.actsetl.infrastructure.eisb.EisbParseException;
import com.actsetl.infrastructure.eisb.ScheduleParser;
import com.actsetl.infrastructure.eisb.hierarchy.HeadingRepairer;
import com.actsetl.infrastructure.eisb.normalize.EntityNormalizer;
import com.actsetl.infrastructure.xml.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Orchestrates the full conversion of one eISB act:
 * <p>
 * parse → entities → metadata → skeleton → body → schedules → headings → toc → active modifications
 * → notes → serialize
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionPipeline {

    private static final int MAX_TRACKED_PARSE_ERRORS = 10;

    private final EntityNormalizer entityNormalizer;
    private final ActMetadataExtractor metadataExtractor;
    private final AknSkeletonBuilder skeletonBuilder;
    private final BodyParser bodyParser;
    private final ScheduleParser scheduleParser;
    private final HeadingRepairer headingRepairer;
    private final TocBuilder tocBuilder;
    private final ActiveModificationsBuilder activeModificationsBuilder;
    private final EditorialNotesBuilder editorialNotesBuilder;
    private final AknWriter aknWriter;

    public ConversionResult execute(String sourceXml) {
        return execute(sourceXml, List.of());
    }

    /**
     * Converts {@code sourceXml}, adding the editorial notes of {@code noteSets} that belong to the act.
     */
    public ConversionResult execute(String sourceXml, List<ActNotes> noteSets) {
        ConversionPipelineContext ctx = new ConversionPipelineContext();
        ctx.setSourceXml(sourceXml);
        ctx.setNoteSets(noteSets != null ? noteSets : List.of());

        // 1. Parse and normalize the source
        parse(ctx);

        // 2. Metadata and skeleton
        ctx.setMetadata(metadataExtractor.extract(ctx.getSourceAct()));
        ctx.setAknRoot(skeletonBuilder.build(ctx.getMetadata()));

        // 3. Body, schedules and inserted headings
        assemble(ctx);

        // 4. Serialize
        ctx.setAknXml(aknWriter.write(ctx.getAknRoot()));

        log.info("Converted {} with {} amendments and {} issues",
                ctx.getMetadata().workUri(), ctx.getAmendments().size(), ctx.getIssues().asList().size());
        return ctx.toConversionResult();
    }

    void parse(ConversionPipelineContext ctx) {
        String sourceXml = ctx.getSourceXml();
        if (sourceXml == null || sourceXml.isBlank()) {
            throw new EisbParseException("eISB document is empty");
        }
        Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_PARSE_ERRORS);
        Document document = Jsoup.parse(sourceXml, "", parser);
        if (!parser.getErrors().isEmpty()) {
            log.warn("eISB document parsed with errors: {}", parser.getErrors());
        }

        Element act = document.selectFirst("act");
        if (act == null) {
            throw new EisbParseException("eISB document has no <act> element");
        }
        if (XmlNodes.child(act, "body").isEmpty()) {
            throw new EisbParseException("eISB document has no <body> element");
        }
        entityNormalizer.normalize(act);
        ctx.setSourceDocument(document);
        ctx.setSourceAct(act);
    }

    void assemble(ConversionPipelineContext ctx) {
        Element sourceBody = XmlNodes.child(ctx.getSourceAct(), "body").orElseThrow();
        Element aknBody = ctx.aknBody();

        BodyParseResult body = bodyParser.parseBody(sourceBody, aknBody, ctx.getIssues());
        ctx.setAmendments(body.amendments());
        ctx.setScheduleCount(scheduleParser.parseSchedules(ctx.getSourceAct(), aknBody));
        headingRepairer.fixHeadings(aknBody);

        ctx.setTocItemCount(tocBuilder.buildToc(ctx.aknAct()));
        activeModificationsBuilder.apply(ctx.aknAct(), ctx.getAmendments());
        ctx.setNoteCount(editorialNotesBuilder.apply(
                ctx.aknAct(), ctx.getMetadata().workUri(), ctx.getNoteSets(), ctx.getIssues()));
    }
}
