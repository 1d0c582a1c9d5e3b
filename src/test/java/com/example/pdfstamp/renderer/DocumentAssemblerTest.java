package com.example.pdfstamp.renderer;

import com.example.pdfstamp.TestPdfs;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentAssemblerTest {

    private final DocumentAssembler assembler = new DocumentAssembler();

    @Test
    public void testPagesAreConcatenatedInOrder() throws Exception {
        try (PDDocument first = PDDocument.load(TestPdfs.template(1));
             PDDocument second = PDDocument.load(TestPdfs.template(2));
             PDDocument merged = assembler.assemble(List.of(first, second))) {

            assertEquals(3, merged.getNumberOfPages());
            assertTrue(TestPdfs.pageText(merged, 1).contains("Template page 1"));
            assertTrue(TestPdfs.pageText(merged, 3).contains("Template page 2"));

            byte[] bytes = assembler.toBytes(merged);
            assertEquals(3, TestPdfs.pageCount(bytes));
        }
    }

    @Test
    public void testEmptyInputGivesEmptyDocument() throws Exception {
        try (PDDocument merged = assembler.assemble(List.of())) {
            assertEquals(0, merged.getNumberOfPages());
        }
    }
}
