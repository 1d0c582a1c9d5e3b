package com.example.pdfstamp.exception;

import lombok.Getter;

/**
 * Raised when a template or its coordinates cannot be resolved.
 * The code drives the HTTP status chosen by the controller.
 */
@Getter
public class TemplateLoadingException extends RuntimeException {

    public static final String COORDINATES_NOT_FOUND = "COORDINATES_NOT_FOUND";
    public static final String TEMPLATE_NOT_FOUND = "TEMPLATE_NOT_FOUND";
    public static final String SERVER_NOT_CONFIGURED = "SERVER_NOT_CONFIGURED";

    private final String code;
    private final String description;

    public TemplateLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public boolean isNotFound() {
        return COORDINATES_NOT_FOUND.equals(code) || TEMPLATE_NOT_FOUND.equals(code);
    }
}
