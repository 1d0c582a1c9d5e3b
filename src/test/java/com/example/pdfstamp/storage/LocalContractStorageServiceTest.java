package com.example.pdfstamp.storage;

import com.example.pdfstamp.exception.ContractStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocalContractStorageServiceTest {

    @TempDir
    Path root;

    private LocalContractStorageService storage;

    @BeforeEach
    public void setup() {
        storage = new LocalContractStorageService(root);
    }

    @Test
    public void testUploadAndDownload() throws Exception {
        storage.upload("contracts/K1_20240101000000.pdf", new byte[]{1, 2}, "application/pdf");

        assertTrue(Files.exists(root.resolve("contracts/K1_20240101000000.pdf")));
        assertArrayEquals(new byte[]{1, 2}, storage.download("contracts/K1_20240101000000.pdf"));
        assertTrue(storage.isEnabled());
    }

    @Test
    public void testListByPrefix() {
        storage.upload("templates/invoice.pdf", new byte[]{1}, "application/pdf");
        storage.upload("templates/annex.pdf", new byte[]{1}, "application/pdf");
        storage.upload("coordinates.json", new byte[]{1}, "application/json");

        List<String> keys = storage.list("templates/");

        assertEquals(2, keys.size());
        assertTrue(keys.containsAll(List.of("templates/invoice.pdf", "templates/annex.pdf")));
    }

    @Test
    public void testMissingObject() {
        ContractStorageException ex = assertThrows(ContractStorageException.class,
                () -> storage.download("coordinates.json"));
        assertTrue(ex.getMessage().contains("Object not found"));
    }

    @Test
    public void testKeysCannotEscapeRoot() {
        assertThrows(ContractStorageException.class,
                () -> storage.upload("../outside.pdf", new byte[]{1}, "application/pdf"));
    }

    @Test
    public void testMissingRootListsNothing() {
        LocalContractStorageService absent = new LocalContractStorageService(root.resolve("absent"));
        assertTrue(absent.list("").isEmpty());
    }
}
