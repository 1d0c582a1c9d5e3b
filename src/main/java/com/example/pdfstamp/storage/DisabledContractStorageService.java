package com.example.pdfstamp.storage;

import com.example.pdfstamp.exception.ContractStorageException;

import java.util.Collections;
import java.util.List;

public class DisabledContractStorageService implements ContractStorageService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void upload(String key, byte[] content, String contentType) {
        throw new ContractStorageException("Contract storage is disabled");
    }

    @Override
    public List<String> list(String prefix) {
        return Collections.emptyList();
    }

    @Override
    public byte[] download(String key) {
        throw new ContractStorageException("Contract storage is disabled");
    }
}
