package com.example.pdfstamp.renderer;

import com.example.pdfstamp.config.StampingProperties;
import com.example.pdfstamp.exception.DocumentStampingException;
import com.example.pdfstamp.model.FieldInstruction;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Draws the instructions of one page onto a blank page of fixed size, using a single
 * font and size. The template's own page size is not consulted.
 *
 * The result has one page, or none when nothing was drawable.
 */
@Slf4j
@Component
public class OverlayRenderer {

    private final PDFont font;
    private final float fontSize;
    private final PDRectangle pageSize;
    private final OverlayLayout layout;

    @Autowired
    public OverlayRenderer(StampingProperties properties) {
        this(PDType1Font.HELVETICA, properties.getRender().getFontSize(),
                pageSize(properties.getRender().getPageSize()));
    }

    public OverlayRenderer(PDFont font, float fontSize, PDRectangle pageSize) {
        this.font = font;
        this.fontSize = fontSize;
        this.pageSize = pageSize;
        this.layout = new OverlayLayout(font, fontSize);
    }

    /**
     * The standard 14 fonts are shared singletons whose glyph caches are not thread safe,
     * so measuring and drawing happen under the font's lock.
     */
    public PDDocument render(List<FieldInstruction> instructions) {
        synchronized (font) {
            return renderPage(instructions);
        }
    }

    private PDDocument renderPage(List<FieldInstruction> instructions) {
        List<PlacedText> placements = layout.layout(instructions);
        PDDocument overlay = new PDDocument();
        if (placements.isEmpty()) {
            return overlay;
        }

        PDPage page = new PDPage(pageSize);
        overlay.addPage(page);
        try (PDPageContentStream contentStream = new PDPageContentStream(overlay, page)) {
            for (PlacedText placement : placements) {
                if (placement.getText().isEmpty()) {
                    continue;
                }
                contentStream.beginText();
                contentStream.setFont(font, fontSize);
                contentStream.newLineAtOffset(placement.getX(), placement.getY());
                contentStream.showText(placement.getText());
                contentStream.endText();
            }
        } catch (IOException e) {
            closeQuietly(overlay);
            throw new DocumentStampingException("Failed to draw overlay page", e);
        }
        return overlay;
    }

    public OverlayLayout getLayout() {
        return layout;
    }

    static PDRectangle pageSize(String name) {
        if (name != null && "A4".equals(name.trim().toUpperCase(Locale.ROOT))) {
            return PDRectangle.A4;
        }
        return PDRectangle.LETTER;
    }

    private static void closeQuietly(PDDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            log.warn("Error closing overlay document", e);
        }
    }
}
