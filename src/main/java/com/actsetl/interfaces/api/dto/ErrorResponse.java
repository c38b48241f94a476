package com.actsetl.interfaces.api.dto;

public record ErrorResponse(
        String code,
        String message
) {
}
