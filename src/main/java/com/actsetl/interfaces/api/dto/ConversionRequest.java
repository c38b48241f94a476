package com.actsetl.interfaces.api.dto;

import com.actsetl.domain.act.model.ActNotes;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ConversionRequest(
        @NotBlank(message = "eISB XML is required.")
        String eisbXml,

        List<ActNotes> notes
) {
}
