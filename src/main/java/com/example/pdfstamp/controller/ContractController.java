package com.example.pdfstamp.controller;

import com.example.pdfstamp.exception.ContractStorageException;
import com.example.pdfstamp.exception.TemplateLoadingException;
import com.example.pdfstamp.model.ContractGenerationRequest;
import com.example.pdfstamp.model.GeneratedContract;
import com.example.pdfstamp.model.StampContext;
import com.example.pdfstamp.model.StoredContract;
import com.example.pdfstamp.service.ContractArchiveService;
import com.example.pdfstamp.service.ContractComposer;
import com.example.pdfstamp.service.TemplateCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for contract generation and retrieval.
 *
 * POST /generate-merged-pdf
 * {
 *   "template_names": ["contract", "annex"],
 *   "context": { "customer_name": "Acme", "customer_nipt": "K123" }
 * }
 *
 * Error bodies carry a machine readable code and a description:
 * { "code": "COORDINATES_NOT_FOUND", "description": "Coordinates for template 'x' not found." }
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ContractController {

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String STORAGE_ERROR = "STORAGE_ERROR";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ContractComposer contractComposer;
    private final ContractArchiveService archiveService;
    private final TemplateCatalog templateCatalog;

    /**
     * Stamp the listed templates with the context, merge them, file the result under the
     * customer's id and return it as a PDF attachment.
     */
    @PostMapping("/generate-merged-pdf")
    public ResponseEntity<?> generateMergedPdf(@RequestBody ContractGenerationRequest request) {
        List<String> templateNames = request.templateNameList();
        if (templateNames == null || templateNames.isEmpty()
                || request.getContext() == null || request.getContext().isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, INVALID_REQUEST,
                    "Request must include 'template_names' (as a list) and 'context'.");
        }
        log.info("Received contract generation request for templates: {}", templateNames);

        try {
            GeneratedContract contract = contractComposer.generate(templateNames, StampContext.of(request.getContext()));

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_PDF);
            headers.setContentDispositionFormData("attachment", "merged_document.pdf");
            headers.setContentLength(contract.getContent().length);
            return new ResponseEntity<>(contract.getContent(), headers, HttpStatus.OK);
        } catch (TemplateLoadingException tle) {
            return templateError(tle);
        } catch (ContractStorageException cse) {
            log.error("Storing the generated contract failed", cse);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_ERROR, "The generated document could not be stored.");
        } catch (RuntimeException e) {
            log.error("An unexpected error occurred while generating templates {}", templateNames, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "An unexpected server error occurred.");
        }
    }

    /**
     * The most recent contract filed for a customer.
     */
    @GetMapping("/contracts/{customerId}/latest")
    public ResponseEntity<?> latestContract(@PathVariable String customerId) {
        try {
            Optional<StoredContract> latest = archiveService.findLatest(customerId);
            if (latest.isEmpty()) {
                return error(HttpStatus.NOT_FOUND, NOT_FOUND, "No contracts found for customer '" + customerId + "'.");
            }
            StoredContract contract = latest.get();
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_PDF);
            headers.setContentDispositionFormData("attachment", contract.fileName());
            headers.setContentLength(contract.getContent().length);
            return new ResponseEntity<>(contract.getContent(), headers, HttpStatus.OK);
        } catch (ContractStorageException cse) {
            log.error("Reading the latest contract of customer '{}' failed", customerId, cse);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_ERROR, "Contracts could not be read from storage.");
        }
    }

    /**
     * Every contract filed for a customer, as a zip archive.
     */
    @GetMapping("/contracts/{customerId}/all")
    public ResponseEntity<?> allContracts(@PathVariable String customerId) {
        try {
            Optional<byte[]> archive = archiveService.zipAll(customerId);
            if (archive.isEmpty()) {
                return error(HttpStatus.NOT_FOUND, NOT_FOUND, "No contracts found for customer '" + customerId + "'.");
            }
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType("application/zip"));
            headers.setContentDispositionFormData("attachment", customerId + "_contracts.zip");
            headers.setContentLength(archive.get().length);
            return new ResponseEntity<>(archive.get(), headers, HttpStatus.OK);
        } catch (ContractStorageException cse) {
            log.error("Packaging the contracts of customer '{}' failed", customerId, cse);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, STORAGE_ERROR, "Contracts could not be read from storage.");
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", templateCatalog.isReady() ? "UP" : "NOT_CONFIGURED");
        body.put("templates", templateCatalog.templateNames().size());
        body.put("coordinates", templateCatalog.coordinateCount());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        log.debug("Rejected unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, INVALID_REQUEST,
                "Request must include 'template_names' (as a list) and 'context'.");
    }

    private ResponseEntity<Map<String, String>> templateError(TemplateLoadingException tle) {
        if (tle.isNotFound()) {
            log.warn("Template resolution failed: {}", tle.getDescription());
            return error(HttpStatus.NOT_FOUND, tle.getCode(), tle.getDescription());
        }
        log.error("Template resolution error", tle);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, tle.getCode(), tle.getDescription());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String description) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("description", description);
        return new ResponseEntity<>(body, status);
    }
}
