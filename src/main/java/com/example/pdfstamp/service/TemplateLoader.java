package com.example.pdfstamp.service;

import com.example.pdfstamp.aspect.LogExecutionTime;
import com.example.pdfstamp.config.StampingProperties;
import com.example.pdfstamp.exception.TemplateLoadingException;
import com.example.pdfstamp.model.CoordinateSpec;
import com.example.pdfstamp.model.FieldPosition;
import com.example.pdfstamp.model.ItemsSection;
import com.example.pdfstamp.storage.ContractStorageService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the coordinate catalog and the template PDFs.
 *
 * Two sources are supported:
 * - storage: {@code coordinates.json} and every {@code templates/*.pdf} object of the blob store
 * - classpath: the same layout below {@code stamping.catalog.classpath-location}
 *
 * The catalog may be JSON or YAML, chosen by file extension. A template's name is the
 * base name of its PDF without the extension.
 */
@Slf4j
@Component
public class TemplateLoader {

    private static final TypeReference<LinkedHashMap<String, CoordinateSpec>> CATALOG_TYPE =
            new TypeReference<LinkedHashMap<String, CoordinateSpec>>() { };

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();

    private final ContractStorageService storageService;
    private final StampingProperties properties;

    public TemplateLoader(ContractStorageService storageService, StampingProperties properties) {
        this.storageService = storageService;
        this.properties = properties;
    }

    public boolean isStorageSource() {
        return !"classpath".equalsIgnoreCase(properties.getCatalog().getSource());
    }

    /**
     * Load catalog and templates from the configured source.
     *
     * @throws TemplateLoadingException if the catalog itself cannot be read
     */
    @LogExecutionTime("Loading Template Catalog")
    public LoadedTemplates load() {
        return isStorageSource() ? loadFromStorage() : loadFromClasspath();
    }

    LoadedTemplates loadFromStorage() {
        StampingProperties.Catalog catalog = properties.getCatalog();
        byte[] coordinatesBytes = storageService.download(catalog.getCoordinates());
        Map<String, CoordinateSpec> coordinates = parseCoordinates(catalog.getCoordinates(), coordinatesBytes);
        log.info("Loaded {} coordinate spec(s) from storage object '{}'", coordinates.size(), catalog.getCoordinates());

        Map<String, byte[]> templates = new LinkedHashMap<>();
        for (String key : storageService.list(catalog.getTemplatesPrefix())) {
            if (!isPdf(key)) {
                continue;
            }
            templates.put(templateName(key), storageService.download(key));
            log.info("Cached template from storage: '{}'", key);
        }
        return new LoadedTemplates(coordinates, templates);
    }

    LoadedTemplates loadFromClasspath() {
        StampingProperties.Catalog catalog = properties.getCatalog();
        String base = "classpath:" + catalog.getClasspathLocation() + "/";
        try {
            Resource coordinatesResource = resourceResolver.getResource(base + catalog.getCoordinates());
            if (!coordinatesResource.exists()) {
                throw new TemplateLoadingException(TemplateLoadingException.COORDINATES_NOT_FOUND,
                        "Coordinate catalog not found on classpath: " + base + catalog.getCoordinates());
            }
            Map<String, CoordinateSpec> coordinates = parseCoordinates(catalog.getCoordinates(), read(coordinatesResource));
            log.info("Loaded {} coordinate spec(s) from '{}'", coordinates.size(), base + catalog.getCoordinates());

            Map<String, byte[]> templates = new LinkedHashMap<>();
            for (Resource resource : resourceResolver.getResources("classpath*:" + catalog.getClasspathLocation()
                    + "/" + catalog.getTemplatesPrefix() + "*.pdf")) {
                String fileName = resource.getFilename();
                if (fileName == null) {
                    continue;
                }
                templates.put(templateName(fileName), read(resource));
                log.info("Cached template from classpath: '{}'", fileName);
            }
            return new LoadedTemplates(coordinates, templates);
        } catch (IOException e) {
            throw new TemplateLoadingException(TemplateLoadingException.TEMPLATE_NOT_FOUND,
                    "Failed to read templates from " + base, e);
        }
    }

    /**
     * Parse a coordinate catalog. Specs that violate the layout rules are logged and left out,
     * so requests for them fail as not found.
     */
    public Map<String, CoordinateSpec> parseCoordinates(String fileName, byte[] content) {
        ObjectMapper mapper = isYaml(fileName) ? yamlMapper : jsonMapper;
        LinkedHashMap<String, CoordinateSpec> parsed;
        try {
            parsed = mapper.readValue(content, CATALOG_TYPE);
        } catch (IOException e) {
            throw new TemplateLoadingException(TemplateLoadingException.COORDINATES_NOT_FOUND,
                    "Coordinate catalog '" + fileName + "' could not be parsed", e);
        }
        Map<String, CoordinateSpec> valid = new LinkedHashMap<>();
        if (parsed == null) {
            return valid;
        }
        parsed.forEach((name, spec) -> {
            String problem = validate(spec);
            if (problem == null) {
                valid.put(name, spec);
            } else {
                log.error("Ignoring coordinates for template '{}': {}", name, problem);
            }
        });
        return valid;
    }

    private String validate(CoordinateSpec spec) {
        if (spec == null) {
            return "empty definition";
        }
        for (Map.Entry<String, FieldPosition> field : spec.getStaticFields().entrySet()) {
            if (field.getValue() == null) {
                return "field '" + field.getKey() + "' has no position";
            }
            if (field.getValue().getPage() < 1) {
                return "field '" + field.getKey() + "' has page " + field.getValue().getPage();
            }
        }
        ItemsSection items = spec.getItemsSection();
        if (items != null) {
            if (items.getPage() < 1) {
                return "items_section has page " + items.getPage();
            }
            if (items.getColumns() == null) {
                return "items_section has no columns";
            }
        }
        return null;
    }

    static String templateName(String key) {
        String name = key.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static boolean isPdf(String key) {
        return key.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static boolean isYaml(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    private static byte[] read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        }
    }
}
