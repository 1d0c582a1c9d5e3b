package com.example.pdfstamp.service;

import com.example.pdfstamp.aspect.LogExecutionTime;
import com.example.pdfstamp.config.StampingProperties;
import com.example.pdfstamp.exception.TemplateLoadingException;
import com.example.pdfstamp.model.FieldInstruction;
import com.example.pdfstamp.model.GeneratedContract;
import com.example.pdfstamp.model.StampContext;
import com.example.pdfstamp.renderer.DocumentAssembler;
import com.example.pdfstamp.renderer.PageCompositor;
import com.example.pdfstamp.storage.ContractStorageService;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one generation request end to end.
 *
 * For each template, in request order: resolve its coordinates, resolve its PDF, bind the
 * context, stamp. Then merge, file the result and hand it back. Any resolution failure aborts
 * the request before anything is stored; a failed upload fails the request as well.
 */
@Slf4j
@Service
public class ContractComposer {

    private final TemplateRepository templateRepository;
    private final FieldBinder fieldBinder;
    private final PageCompositor pageCompositor;
    private final DocumentAssembler documentAssembler;
    private final ContractArchiveService archiveService;
    private final ContractStorageService storageService;
    private final StampingProperties properties;

    public ContractComposer(TemplateRepository templateRepository, FieldBinder fieldBinder,
                            PageCompositor pageCompositor, DocumentAssembler documentAssembler,
                            ContractArchiveService archiveService, ContractStorageService storageService,
                            StampingProperties properties) {
        this.templateRepository = templateRepository;
        this.fieldBinder = fieldBinder;
        this.pageCompositor = pageCompositor;
        this.documentAssembler = documentAssembler;
        this.archiveService = archiveService;
        this.storageService = storageService;
        this.properties = properties;
    }

    @LogExecutionTime("Total Contract Generation")
    public GeneratedContract generate(List<String> templateNames, StampContext context) {
        if (!storageService.isEnabled() || !templateRepository.isReady()) {
            throw new TemplateLoadingException(TemplateLoadingException.SERVER_NOT_CONFIGURED,
                    "Server is not configured correctly. Cannot connect to storage.");
        }
        log.info("Generating contract from {} template(s): {}", templateNames.size(), templateNames);

        List<PDDocument> stampedDocuments = new ArrayList<>();
        PDDocument output = null;
        try {
            for (String templateName : templateNames) {
                stampedDocuments.add(stampTemplate(templateName, context));
            }

            output = documentAssembler.assemble(stampedDocuments);
            byte[] content = documentAssembler.toBytes(output);
            int pageCount = output.getNumberOfPages();

            String storageKey = archiveService.store(customerId(context), content);
            log.info("Contract generation complete. Pages: {}, size: {} bytes", pageCount, content.length);
            return new GeneratedContract(storageKey, content, pageCount);
        } finally {
            closeAll(stampedDocuments, output);
        }
    }

    private PDDocument stampTemplate(String templateName, StampContext context) {
        if (templateRepository.findCoordinates(templateName).isEmpty()) {
            throw new TemplateLoadingException(TemplateLoadingException.COORDINATES_NOT_FOUND,
                    "Coordinates for template '" + templateName + "' not found.");
        }
        byte[] source = templateRepository.findTemplate(templateName)
                .orElseThrow(() -> new TemplateLoadingException(TemplateLoadingException.TEMPLATE_NOT_FOUND,
                        "Template PDF '" + templateName + ".pdf' not found."));

        Map<Integer, List<FieldInstruction>> instructions = fieldBinder.bind(templateName, context);
        log.debug("Stamping template '{}' on {} page(s)", templateName, instructions.size());
        return pageCompositor.composite(templateName, source, instructions);
    }

    String customerId(StampContext context) {
        for (String key : List.of(StampContext.CUSTOMER_NIPT, StampContext.NIPT)) {
            String value = context.getText(key).map(String::trim).orElse("");
            if (!value.isEmpty()) {
                return value;
            }
        }
        return properties.getContracts().getUnknownCustomerId();
    }

    private void closeAll(List<PDDocument> stampedDocuments, PDDocument output) {
        for (PDDocument document : stampedDocuments) {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Error closing stamped document", e);
            }
        }
        if (output != null) {
            try {
                output.close();
            } catch (IOException e) {
                log.warn("Error closing merged document", e);
            }
        }
    }
}
