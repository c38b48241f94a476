package com.actsetl.application.conversion.exception;

public class InputTooLargeException extends RuntimeException {
    public InputTooLargeException(long maxBytes) {
        super(String.format("eISB documents are limited to %d bytes.", maxBytes));
    }
}
