package com.example.pdfstamp.renderer;

import com.example.pdfstamp.aspect.LogExecutionTime;
import com.example.pdfstamp.exception.DocumentStampingException;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Concatenates stamped documents in the given order.
 * The source documents must stay open until the result has been saved.
 */
@Component
public class DocumentAssembler {

    @LogExecutionTime("Merging Stamped Templates")
    public PDDocument assemble(List<PDDocument> stampedDocuments) {
        PDDocument result = new PDDocument();
        PDFMergerUtility merger = new PDFMergerUtility();
        try {
            for (PDDocument stamped : stampedDocuments) {
                merger.appendDocument(result, stamped);
            }
            return result;
        } catch (IOException e) {
            try {
                result.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw new DocumentStampingException("Failed to merge stamped templates", e);
        }
    }

    public byte[] toBytes(PDDocument document) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            document.save(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new DocumentStampingException("Failed to serialize output document", e);
        }
    }
}
