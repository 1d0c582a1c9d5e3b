package com.example.pdfstamp.service;

import com.example.pdfstamp.config.StampingProperties;
import com.example.pdfstamp.model.StoredContract;
import com.example.pdfstamp.storage.LocalContractStorageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Contract Archive Tests")
public class ContractArchiveServiceTest {

    private static final Instant T1 = Instant.parse("2024-01-31T23:59:59Z");

    @TempDir
    Path root;

    private LocalContractStorageService storage;
    private StampingProperties properties;

    @BeforeEach
    public void setup() {
        storage = new LocalContractStorageService(root);
        properties = new StampingProperties();
    }

    private ContractArchiveService archiveAt(Instant instant) {
        return new ContractArchiveService(storage, properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Keys combine prefix, customer id and a 14 digit timestamp")
    public void testStorageKeyFormat() {
        assertEquals("contracts/K123_20240131235959.pdf", archiveAt(T1).store("K123", new byte[]{1}));
        assertArrayEquals(new byte[]{1}, storage.download("contracts/K123_20240131235959.pdf"));
    }

    @Test
    @DisplayName("The timestamp follows the configured zone")
    public void testConfiguredZone() {
        properties.getContracts().setZone("Europe/Tirane");

        assertEquals("contracts/K123_20240201005959.pdf", archiveAt(T1).storageKey("K123"));
    }

    @Test
    @DisplayName("Blank or unsafe customer ids are normalized")
    public void testCustomerIdNormalization() {
        ContractArchiveService archive = archiveAt(T1);

        assertEquals("contracts/UNKNOWN_NIPT_20240131235959.pdf", archive.storageKey("  "));
        assertEquals("contracts/a_b_20240131235959.pdf", archive.storageKey("a/b"));
    }

    @Test
    @DisplayName("Latest is the contract with the greatest timestamp")
    public void testFindLatest() {
        archiveAt(T1.minusSeconds(120)).store("K123", bytes("first"));
        archiveAt(T1).store("K123", bytes("third"));
        archiveAt(T1.minusSeconds(60)).store("K123", bytes("second"));

        Optional<StoredContract> latest = archiveAt(T1).findLatest("K123");

        assertTrue(latest.isPresent());
        assertEquals("contracts/K123_20240131235959.pdf", latest.get().getKey());
        assertEquals("K123_20240131235959.pdf", latest.get().fileName());
        assertEquals("third", new String(latest.get().getContent(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Contracts of customers sharing an id prefix are kept apart")
    public void testPrefixCollision() {
        archiveAt(T1.minusSeconds(60)).store("K1", bytes("mine"));
        archiveAt(T1).store("K1_X", bytes("other"));
        archiveAt(T1).store("K12", bytes("other"));

        ContractArchiveService archive = archiveAt(T1);
        assertEquals(List.of("contracts/K1_20240131235859.pdf"), archive.listContractKeys("K1"));
        assertEquals("mine", new String(archive.findLatest("K1").get().getContent(), StandardCharsets.UTF_8));
    }

    @Test
    public void testNoContracts() {
        assertTrue(archiveAt(T1).findLatest("NOBODY").isEmpty());
        assertTrue(archiveAt(T1).zipAll("NOBODY").isEmpty());
    }

    @Test
    @DisplayName("Zip holds every contract of the customer under its file name")
    public void testZipAll() throws Exception {
        archiveAt(T1.minusSeconds(1)).store("K123", bytes("one"));
        archiveAt(T1).store("K123", bytes("two"));
        archiveAt(T1).store("OTHER", bytes("x"));

        byte[] zip = archiveAt(T1).zipAll("K123").orElseThrow();

        List<String> names = new ArrayList<>();
        List<String> contents = new ArrayList<>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                names.add(entry.getName());
                contents.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        assertEquals(List.of("K123_20240131235958.pdf", "K123_20240131235959.pdf"), names);
        assertEquals(List.of("one", "two"), contents);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
