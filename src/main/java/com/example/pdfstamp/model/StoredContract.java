package com.example.pdfstamp.model;

import lombok.Value;

/**
 * A contract read back from storage.
 */
@Value
public class StoredContract {
    String key;
    byte[] content;

    public String fileName() {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }
}
