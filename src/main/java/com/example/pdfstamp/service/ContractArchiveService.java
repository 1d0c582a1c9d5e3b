package com.example.pdfstamp.service;

import com.example.pdfstamp.config.StampingProperties;
import com.example.pdfstamp.exception.ContractStorageException;
import com.example.pdfstamp.model.StoredContract;
import com.example.pdfstamp.storage.ContractStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Files assembled contracts per customer and reads them back.
 *
 * Keys look like {@code contracts/K123_20240131235959.pdf}. The timestamp is fixed width
 * and zero padded, so the lexicographically greatest key of a customer is the latest one.
 */
@Slf4j
@Service
public class ContractArchiveService {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss", Locale.ROOT);
    private static final Pattern UNSAFE_CUSTOMER_ID = Pattern.compile("[^A-Za-z0-9._-]");

    private final ContractStorageService storageService;
    private final StampingProperties properties;
    private final Clock clock;

    public ContractArchiveService(ContractStorageService storageService, StampingProperties properties, Clock clock) {
        this.storageService = storageService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Upload a contract under a fresh timestamped key.
     *
     * @return the storage key
     * @throws ContractStorageException if the upload fails
     */
    public String store(String customerId, byte[] content) {
        String key = storageKey(customerId);
        storageService.upload(key, content, MediaType.APPLICATION_PDF_VALUE);
        log.info("Successfully uploaded '{}' to storage", key);
        return key;
    }

    public Optional<StoredContract> findLatest(String customerId) {
        List<String> keys = listContractKeys(customerId);
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        String latest = keys.get(keys.size() - 1);
        return Optional.of(new StoredContract(latest, storageService.download(latest)));
    }

    /**
     * All contracts of a customer as a zip archive, entries named by base file name.
     */
    public Optional<byte[]> zipAll(String customerId) {
        List<String> keys = listContractKeys(customerId);
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ZipOutputStream zip = new ZipOutputStream(baos)) {
            for (String key : keys) {
                StoredContract contract = new StoredContract(key, storageService.download(key));
                zip.putNextEntry(new ZipEntry(contract.fileName()));
                zip.write(contract.getContent());
                zip.closeEntry();
            }
            zip.finish();
            log.info("Packaged {} contract(s) for customer '{}'", keys.size(), customerId);
            return Optional.of(baos.toByteArray());
        } catch (IOException e) {
            throw new ContractStorageException("Failed to package contracts for customer '" + customerId + "'", e);
        }
    }

    /**
     * Contract keys of one customer in ascending (chronological) order.
     */
    List<String> listContractKeys(String customerId) {
        String prefix = customerPrefix(customerId);
        Pattern ownKey = Pattern.compile(Pattern.quote(prefix) + "\\d{14}\\.pdf");
        return storageService.list(prefix).stream()
                .filter(key -> ownKey.matcher(key).matches())
                .sorted()
                .collect(Collectors.toList());
    }

    String storageKey(String customerId) {
        String timestamp = TIMESTAMP.format(clock.instant().atZone(ZoneId.of(properties.getContracts().getZone())));
        return customerPrefix(customerId) + timestamp + ".pdf";
    }

    String customerPrefix(String customerId) {
        return properties.getContracts().getPrefix() + safeCustomerId(customerId) + "_";
    }

    private String safeCustomerId(String customerId) {
        String id = customerId == null ? "" : UNSAFE_CUSTOMER_ID.matcher(customerId.trim()).replaceAll("_");
        return id.isEmpty() ? properties.getContracts().getUnknownCustomerId() : id;
    }
}
