package com.example.pdfstamp.storage;

import java.util.List;

/**
 * Key/value blob store holding the coordinate catalog, the template PDFs and the filed contracts.
 * Implementations throw {@link com.example.pdfstamp.exception.ContractStorageException} on failure.
 */
public interface ContractStorageService {

    boolean isEnabled();

    void upload(String key, byte[] content, String contentType);

    /** Keys starting with the prefix, in no particular order. */
    List<String> list(String prefix);

    byte[] download(String key);
}
