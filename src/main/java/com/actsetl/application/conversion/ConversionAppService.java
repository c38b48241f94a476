package com.actsetl.application.conversion;

import com.actsetl.application.conversion.exception.InputTooLargeException;
import com.actsetl.domain.act.model.ActNotes;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.infrastructure.pipeline.ConversionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionAppService {

    private final ConversionPipeline conversionPipeline;

    @Value("${actsetl.input.max-bytes:20971520}")
    private long maxInputBytes;

    /**
     * Converts one eISB act to Akoma Ntoso.
     */
    public ConversionResult convert(String eisbXml) {
        return convert(eisbXml, List.of());
    }

    /**
     * Converts one eISB act to Akoma Ntoso with editorial notes.
     */
    public ConversionResult convert(String eisbXml, List<ActNotes> noteSets) {
        if (eisbXml != null && eisbXml.getBytes(StandardCharsets.UTF_8).length > maxInputBytes) {
            throw new InputTooLargeException(maxInputBytes);
        }
        ConversionResult result = conversionPipeline.execute(eisbXml, noteSets);
        if (result.hasErrors()) {
            log.warn("Conversion finished with {} issues", result.issues().size());
        }
        return result;
    }
}
