package com.example.pdfstamp.service;

import com.example.pdfstamp.model.CoordinateSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide holder of the coordinate catalog and the template store.
 *
 * The contents are published once through a volatile snapshot and never change
 * afterwards, so concurrent requests read them without locking. Until
 * {@link #initialize(LoadedTemplates)} runs the catalog reports itself as not ready,
 * which is different from a template simply being absent.
 */
@Slf4j
@Component
public class TemplateCatalog implements TemplateRepository {

    private volatile LoadedTemplates contents;

    public void initialize(LoadedTemplates loaded) {
        this.contents = new LoadedTemplates(Map.copyOf(loaded.getCoordinates()), Map.copyOf(loaded.getTemplates()));
        log.info("Template catalog ready: {} coordinate spec(s), {} template(s)",
                loaded.getCoordinates().size(), loaded.getTemplates().size());
    }

    @Override
    public boolean isReady() {
        return contents != null;
    }

    @Override
    public Optional<CoordinateSpec> findCoordinates(String templateName) {
        LoadedTemplates current = contents;
        if (current == null || templateName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.getCoordinates().get(templateName));
    }

    @Override
    public Optional<byte[]> findTemplate(String templateName) {
        LoadedTemplates current = contents;
        if (current == null || templateName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.getTemplates().get(templateName)).map(byte[]::clone);
    }

    public Set<String> templateNames() {
        LoadedTemplates current = contents;
        return current == null ? Set.of() : new TreeSet<>(current.getTemplates().keySet());
    }

    public int coordinateCount() {
        LoadedTemplates current = contents;
        return current == null ? 0 : current.getCoordinates().size();
    }
}
