package com.example.pdfstamp.service;

import com.example.pdfstamp.model.CoordinateSpec;
import lombok.Value;

import java.util.Map;

/**
 * Result of one catalog load: coordinate specs and template PDFs keyed by template name.
 */
@Value
public class LoadedTemplates {
    Map<String, CoordinateSpec> coordinates;
    Map<String, byte[]> templates;

    public static LoadedTemplates empty() {
        return new LoadedTemplates(Map.of(), Map.of());
    }
}
