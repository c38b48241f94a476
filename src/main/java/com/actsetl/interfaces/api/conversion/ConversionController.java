package com.actsetl.interfaces.api.conversion;

import com.actsetl.application.conversion.ConversionAppService;
import com.actsetl.domain.conversion.model.ConversionResult;
import com.actsetl.interfaces.api.dto.ConversionRequest;
import com.actsetl.interfaces.api.dto.ConversionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/conversions")
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionAppService conversionAppService;

    @PostMapping(consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ConversionResponse> convert(@RequestBody String eisbXml) {
        ConversionResult result = conversionAppService.convert(eisbXml);
        return ResponseEntity.ok(ConversionResponse.from(result));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConversionResponse> convertJson(@Valid @RequestBody ConversionRequest request) {
        ConversionResult result = conversionAppService.convert(request.eisbXml(), request.notes());
        return ResponseEntity.ok(ConversionResponse.from(result));
    }

    @PostMapping(path = "/akn",
            consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE},
            produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> convertToAkn(@RequestBody String eisbXml) {
        ConversionResult result = conversionAppService.convert(eisbXml);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(result.aknXml());
    }
}
