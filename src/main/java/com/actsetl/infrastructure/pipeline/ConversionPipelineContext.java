package com.actsetl.infrastructure.pipeline;

import com.actsetl.domain.act.model.ActMetadata;
import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.amendment.model.AmendmentMetadata;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.infrastructure.eisb.ConversionIssues;
import lombok.Data;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class ConversionPipelineContext {

    // --- Input ---
    private String sourceXml;
    private List<ActNotes> noteSets = new ArrayList<>();

    // --- Parse ---
    private Document sourceDocument;
    private Element sourceAct;

    // --- Metadata ---
    private ActMetadata metadata;

    // --- Assembly ---
    private Element aknRoot;
    private List<AmendmentMetadata> amendments = new ArrayList<>();
    private int scheduleCount;
    private int tocItemCount;
    private int noteCount;

    // --- Output ---
    private String aknXml;

    private final ConversionIssues issues = new ConversionIssues();

    public Element aknAct() {
        return aknRoot.selectFirst("act");
    }

    public Element aknBody() {
        return aknRoot.selectFirst("act > body");
    }

    /**
     * Build the final ConversionResult from accumulated context.
     */
    public ConversionResult toConversionResult() {
        return new ConversionResult(aknXml, List.copyOf(amendments), issues.asList());
    }
}
