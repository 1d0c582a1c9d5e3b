package com.example.pdfstamp.service;

import com.example.pdfstamp.exception.TemplateLoadingException;
import com.example.pdfstamp.model.Alignment;
import com.example.pdfstamp.model.CoordinateSpec;
import com.example.pdfstamp.model.FieldInstruction;
import com.example.pdfstamp.model.FieldPosition;
import com.example.pdfstamp.model.FinalTotal;
import com.example.pdfstamp.model.ItemsList;
import com.example.pdfstamp.model.ItemsSection;
import com.example.pdfstamp.model.LineItem;
import com.example.pdfstamp.model.StampContext;
import com.example.pdfstamp.model.StaticText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Binds a context against a template's coordinates.
 *
 * The result maps 0-indexed page numbers to the instructions drawn on that page:
 * static fields in catalog order, then the items table, then the total line.
 * Fields whose name is missing from the context are skipped; pages without any
 * instruction are absent from the result.
 */
@Slf4j
@Component
public class FieldBinder {

    static final DateTimeFormatter DOC_DATE_FORMAT =
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT);

    private final TemplateRepository templateRepository;

    public FieldBinder(TemplateRepository templateRepository) {
        this.templateRepository = templateRepository;
    }

    public SortedMap<Integer, List<FieldInstruction>> bind(String templateName, StampContext context) {
        CoordinateSpec spec = templateRepository.findCoordinates(templateName)
                .orElseThrow(() -> new TemplateLoadingException(TemplateLoadingException.COORDINATES_NOT_FOUND,
                        "Coordinates for template '" + templateName + "' not found."));
        return bind(templateName, spec, prepare(templateName, context));
    }

    /**
     * Adds derived fields and checks the document date. Never fails.
     */
    StampContext prepare(String templateName, StampContext context) {
        StampContext prepared = context;
        if (context.contains(StampContext.CUSTOMER_ADDRESS) && context.contains(StampContext.CUSTOMER_CITY)) {
            String fullAddress = context.getText(StampContext.CUSTOMER_ADDRESS).orElse("")
                    + ", " + context.getText(StampContext.CUSTOMER_CITY).orElse("");
            prepared = prepared.with(StampContext.CUSTOMER_FULL_ADDRESS, fullAddress);
        }
        if (context.contains(StampContext.DOC_DATE)) {
            String docDate = context.getText(StampContext.DOC_DATE).orElse("");
            if (!isValidDocDate(docDate)) {
                log.warn("Could not validate doc_date format for template '{}': '{}'. Using original value.",
                        templateName, docDate);
            }
        }
        return prepared;
    }

    static boolean isValidDocDate(String value) {
        try {
            LocalDate.parse(value.trim(), DOC_DATE_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private SortedMap<Integer, List<FieldInstruction>> bind(String templateName, CoordinateSpec spec,
                                                            StampContext context) {
        SortedMap<Integer, List<FieldInstruction>> byPage = new TreeMap<>();

        for (Map.Entry<String, FieldPosition> field : spec.getStaticFields().entrySet()) {
            String fieldName = field.getKey();
            if (!context.contains(fieldName)) {
                continue;
            }
            FieldPosition position = field.getValue();
            Alignment align = position.getAlign() != null ? position.getAlign() : Alignment.LEFT;
            byPage.computeIfAbsent(position.getPage() - 1, page -> new ArrayList<>())
                    .add(new StaticText(context.getText(fieldName).orElse(""), position.getX(), position.getY(), align));
        }

        ItemsSection itemsSection = spec.getItemsSection();
        List<LineItem> rows = context.getItems();
        if (itemsSection != null && !rows.isEmpty()) {
            List<FieldInstruction> page = byPage.computeIfAbsent(itemsSection.getPage() - 1, p -> new ArrayList<>());
            page.add(new ItemsList(rows, itemsSection.getColumns(), itemsSection.getStartY(),
                    itemsSection.getLineHeight()));
            page.add(new FinalTotal(context.getTotal(), itemsSection.getColumns().getNameX(),
                    itemsSection.getLineHeight()));
        }

        log.debug("Bound template '{}': {} page(s) with instructions", templateName, byPage.size());
        return byPage;
    }
}
