package com.example.pdfstamp.config;

import com.example.pdfstamp.storage.ContractStorageService;
import com.example.pdfstamp.storage.DisabledContractStorageService;
import com.example.pdfstamp.storage.GcsContractStorageService;
import com.example.pdfstamp.storage.LocalContractStorageService;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Selects the blob store backing the catalog and the filed contracts.
 */
@Configuration
@EnableConfigurationProperties(StampingProperties.class)
public class StorageConfiguration {

    @Bean
    @ConditionalOnProperty(name = "stamping.storage.type", havingValue = "gcs")
    public Storage storage() {
        return StorageOptions.getDefaultInstance().getService();
    }

    @Bean
    @ConditionalOnProperty(name = "stamping.storage.type", havingValue = "gcs")
    public ContractStorageService gcsContractStorageService(Storage storage, StampingProperties properties) {
        return new GcsContractStorageService(storage, properties.getStorage().getBucket());
    }

    @Bean
    @ConditionalOnProperty(name = "stamping.storage.type", havingValue = "local")
    public ContractStorageService localContractStorageService(StampingProperties properties) {
        return new LocalContractStorageService(Paths.get(properties.getStorage().getLocalRoot()));
    }

    @Bean
    @ConditionalOnProperty(name = "stamping.storage.type", havingValue = "none", matchIfMissing = true)
    public ContractStorageService disabledContractStorageService() {
        return new DisabledContractStorageService();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
