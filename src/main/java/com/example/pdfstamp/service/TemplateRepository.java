package com.example.pdfstamp.service;

import com.example.pdfstamp.model.CoordinateSpec;

import java.util.Optional;

/**
 * Read-only view of the coordinate catalog and the template store.
 * Lookups are only meaningful once {@link #isReady()} returns true.
 */
public interface TemplateRepository {

    boolean isReady();

    Optional<CoordinateSpec> findCoordinates(String templateName);

    /** Raw PDF bytes of the template; callers get their own copy. */
    Optional<byte[]> findTemplate(String templateName);
}
