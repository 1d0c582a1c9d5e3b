package com.example.pdfstamp.renderer;

import com.example.pdfstamp.aspect.LogExecutionTime;
import com.example.pdfstamp.exception.DocumentStampingException;
import com.example.pdfstamp.model.FieldInstruction;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.multipdf.LayerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Stamps overlays onto a fresh copy of a template.
 *
 * The copy keeps the template's page count and order. Each overlay is imported as a
 * form XObject and drawn after the page's own content, so the original content stays
 * underneath. Pages without instructions, and pages whose overlay came out empty,
 * are left as they are.
 */
@Slf4j
@Component
public class PageCompositor {

    private final OverlayRenderer overlayRenderer;

    public PageCompositor(OverlayRenderer overlayRenderer) {
        this.overlayRenderer = overlayRenderer;
    }

    @LogExecutionTime("Compositing Template Pages")
    public PDDocument composite(String templateName, byte[] templateSource,
                                Map<Integer, List<FieldInstruction>> instructionsByPage) {
        PDDocument stamped;
        try {
            stamped = PDDocument.load(templateSource);
        } catch (IOException e) {
            throw new DocumentStampingException("Template PDF '" + templateName + "' could not be read", e);
        }

        try {
            LayerUtility layerUtility = new LayerUtility(stamped);
            int pageCount = stamped.getNumberOfPages();
            for (Map.Entry<Integer, List<FieldInstruction>> entry : instructionsByPage.entrySet()) {
                int pageIndex = entry.getKey();
                if (pageIndex < 0 || pageIndex >= pageCount) {
                    log.warn("Template '{}' has {} page(s); skipping instructions for page {}",
                            templateName, pageCount, pageIndex + 1);
                    continue;
                }
                stampPage(layerUtility, stamped, stamped.getPage(pageIndex), entry.getValue());
            }
            return stamped;
        } catch (IOException e) {
            closeQuietly(stamped);
            throw new DocumentStampingException("Failed to stamp template '" + templateName + "'", e);
        } catch (RuntimeException e) {
            closeQuietly(stamped);
            throw e;
        }
    }

    private void stampPage(LayerUtility layerUtility, PDDocument target, PDPage page,
                           List<FieldInstruction> instructions) throws IOException {
        try (PDDocument overlay = overlayRenderer.render(instructions)) {
            if (overlay.getNumberOfPages() == 0) {
                return;
            }
            PDFormXObject form = layerUtility.importPageAsForm(overlay, 0);
            try (PDPageContentStream contentStream = new PDPageContentStream(
                    target, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                contentStream.drawForm(form);
            }
        }
    }

    private static void closeQuietly(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Error closing stamped document", e);
        }
    }
}
