package com.example.pdfstamp.storage;

import com.example.pdfstamp.exception.ContractStorageException;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Google Cloud Storage backed blob store. One bucket holds the catalog,
 * the templates and the filed contracts.
 */
@Slf4j
public class GcsContractStorageService implements ContractStorageService {

    private final Storage storage;
    private final String bucket;

    public GcsContractStorageService(Storage storage, String bucket) {
        Assert.isTrue(StringUtils.hasText(bucket),
                "stamping.storage.bucket must be configured when Google Cloud Storage is enabled");
        this.storage = storage;
        this.bucket = bucket;
        log.info("Using GCS bucket '{}' for templates and contracts", bucket);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void upload(String key, byte[] content, String contentType) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key))
                .setContentType(contentType)
                .build();
        try {
            storage.create(blobInfo, content);
        } catch (StorageException ex) {
            throw new ContractStorageException("Failed to upload 'gs://%s/%s'".formatted(bucket, key), ex);
        }
    }

    @Override
    public List<String> list(String prefix) {
        try {
            List<String> keys = new ArrayList<>();
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                if (!blob.isDirectory()) {
                    keys.add(blob.getName());
                }
            }
            return keys;
        } catch (StorageException ex) {
            throw new ContractStorageException("Unable to list 'gs://%s/%s'".formatted(bucket, prefix), ex);
        }
    }

    @Override
    public byte[] download(String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null) {
                throw new ContractStorageException("Object not found: 'gs://%s/%s'".formatted(bucket, key));
            }
            return blob.getContent();
        } catch (StorageException ex) {
            throw new ContractStorageException("Failed to download 'gs://%s/%s'".formatted(bucket, key), ex);
        }
    }
}
