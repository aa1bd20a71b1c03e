package com.queryengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine settings bound from {@code app.query-engine.*}.
 *
 * Defaults match what production runs with; tests construct this directly.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.query-engine")
public class QueryEngineProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Security security = new Security();

    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Cache {

        // Data refreshes periodically, keep results short-lived
        @Min(1)
        private long resultTtlSeconds = 300;

        @Min(1)
        private long columnMappingTtlSeconds = 3600;

        @Min(1)
        private long configTtlSeconds = 3600;

        @NotBlank
        private String keyPrefix = "analytics";
    }

    @Data
    public static class Retry {

        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long initialBackoffMs = 100;

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Execution {

        @Min(1)
        private int queryTimeoutSeconds = 30;

        @Min(1)
        private long comparisonTimeoutSeconds = 60;
    }

    @Data
    public static class Security {

        @NotBlank
        private String tenantColumn = "tenant_id";

        @NotBlank
        private String subEntityColumn = "provider_uid";
    }

    @Data
    public static class Executor {

        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 100;
    }
}
