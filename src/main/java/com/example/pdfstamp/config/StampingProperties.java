package com.example.pdfstamp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the stamping service.
 *
 * Example application.yml:
 *
 * stamping:
 *   storage:
 *     type: gcs
 *     bucket: contracts-bucket
 *   catalog:
 *     source: storage
 *     coordinates: coordinates.json
 *     templates-prefix: templates/
 *   render:
 *     font-size: 12
 *     page-size: LETTER
 *   contracts:
 *     prefix: contracts/
 *     zone: Europe/Tirane
 */
@Data
@ConfigurationProperties(prefix = "stamping")
public class StampingProperties {

    private Storage storage = new Storage();

    private Catalog catalog = new Catalog();

    private Render render = new Render();

    private Contracts contracts = new Contracts();

    @Data
    public static class Storage {
        /**
         * gcs, local or none
         */
        private String type = "none";

        /**
         * Bucket holding the catalog, the templates and the filed contracts (gcs only)
         */
        private String bucket;

        /**
         * Root directory used as the bucket (local only)
         */
        private String localRoot = "./data";
    }

    @Data
    public static class Catalog {
        /**
         * storage: read from the configured blob store; classpath: read from {@link #classpathLocation}
         */
        private String source = "storage";

        /**
         * Object name of the coordinate catalog, .json or .yaml/.yml
         */
        private String coordinates = "coordinates.json";

        private String templatesPrefix = "templates/";

        private String classpathLocation = "stamping";
    }

    @Data
    public static class Render {
        private float fontSize = 12f;

        /**
         * LETTER or A4
         */
        private String pageSize = "LETTER";
    }

    @Data
    public static class Contracts {
        private String prefix = "contracts/";

        /**
         * Zone used for the timestamp part of the storage key
         */
        private String zone = "UTC";

        private String unknownCustomerId = "UNKNOWN_NIPT";
    }
}
