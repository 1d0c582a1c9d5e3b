package com.example.pdfstamp.storage;

import com.example.pdfstamp.exception.ContractStorageException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DisabledContractStorageServiceTest {

    private final DisabledContractStorageService storage = new DisabledContractStorageService();

    @Test
    public void testEverythingIsRefused() {
        assertFalse(storage.isEnabled());
        assertTrue(storage.list("contracts/").isEmpty());
        assertThrows(ContractStorageException.class, () -> storage.upload("a.pdf", new byte[0], "application/pdf"));
        assertThrows(ContractStorageException.class, () -> storage.download("a.pdf"));
    }
}
