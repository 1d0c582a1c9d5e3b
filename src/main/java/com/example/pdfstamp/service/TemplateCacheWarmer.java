package com.example.pdfstamp.service;

import com.example.pdfstamp.storage.ContractStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fills the {@link TemplateCatalog} once the application is up.
 *
 * - storage source but no storage configured: the catalog stays not ready and every
 *   generation request is answered with a configuration error
 * - load failure: the catalog is published empty, so every template is reported as not found
 */
@Slf4j
@Component
public class TemplateCacheWarmer {

    private final TemplateLoader templateLoader;
    private final TemplateCatalog templateCatalog;
    private final ContractStorageService storageService;

    public TemplateCacheWarmer(TemplateLoader templateLoader, TemplateCatalog templateCatalog,
                               ContractStorageService storageService) {
        this.templateLoader = templateLoader;
        this.templateCatalog = templateCatalog;
        this.storageService = storageService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmCache() {
        if (templateLoader.isStorageSource() && !storageService.isEnabled()) {
            log.error("FATAL: no storage configured (stamping.storage.type); templates cannot be loaded");
            return;
        }

        log.info("Starting template catalog loading");
        long startTime = System.currentTimeMillis();
        try {
            templateCatalog.initialize(templateLoader.load());
        } catch (Exception e) {
            log.error("FATAL STARTUP ERROR: could not load coordinates and templates", e);
            templateCatalog.initialize(LoadedTemplates.empty());
        }
        log.info("Template catalog loading completed in {}ms", System.currentTimeMillis() - startTime);
    }
}
