package com.imageinsight.describer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalized settings for the description service.
 *
 * <pre>
 * describer:
 *   api:
 *     base-url: https://api.visionati.com
 *     api-key: ${DESCRIBER_API_KEY:}
 *   defaults:
 *     backend: gemini
 *     language: English
 *   batch:
 *     size: 10
 *   polling:
 *     interval-ms: 2000
 *     max-attempts: 30      # ~60s ceiling per job
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "describer")
@Data
public class DescriberProperties {

    private Api api = new Api();

    private Defaults defaults = new Defaults();

    private Batch batch = new Batch();

    private Polling polling = new Polling();

    @Data
    public static class Api {
        private String baseUrl = "https://api.visionati.com";

        /** Submit endpoint, relative to the base URL */
        private String fetchPath = "/api/fetch";

        private String apiKey = "";

        private int connectTimeoutMs = 10000;

        private int readTimeoutMs = 60000;

        private String userAgent = "ImageInsight-Describer/1.0";

        /** Largest request body accepted by the client codecs (base64 images are big) */
        private int maxInMemorySizeBytes = 16 * 1024 * 1024;
    }

    @Data
    public static class Defaults {
        /** Model backend, e.g. gemini, claude, openai */
        private String backend = "gemini";

        private String language = "English";

        /** Custom prompt; overrides the field role when non-blank */
        private String prompt = "";
    }

    @Data
    public static class Batch {
        /** Max images per API call */
        private int size = 10;
    }

    @Data
    public static class Polling {
        private long intervalMs = 2000;

        private int maxAttempts = 30;
    }
}
