package com.example.pdfstamp.exception;

/**
 * Wraps PDF level failures (parsing a template, drawing an overlay, saving the output).
 */
public class DocumentStampingException extends RuntimeException {

    public DocumentStampingException(String message, Throwable cause) {
        super(message, cause);
    }
}
