package com.darksite.metering.config;

import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.ResourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Startup configuration for the metering engine.
 *
 * Bound once from {@code metering.*}; changing any value requires a restart.
 * See application.yml for the environment variables each property maps to.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "metering")
public class MeteringProperties {

    /**
     * Account id the original deployment shipped with. Exports treat it as "not configured".
     */
    public static final String DEFAULT_ACCOUNT_ID = "123456";

    @Valid
    private Prism prism = new Prism();

    @Valid
    private Collection collection = new Collection();

    @Valid
    private Auth auth = new Auth();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Export export = new Export();

    @Valid
    private Billing billing = new Billing();

    /**
     * Resource kind to the API generations polled for it.
     */
    private Map<ResourceKind, List<ApiGeneration>> routes = defaultRoutes();

    /**
     * Metric name to generations in authority order; metrics not listed use the default order.
     */
    private Map<String, List<ApiGeneration>> precedence = new HashMap<>();

    private List<ApiGeneration> defaultPrecedence = List.of(
            ApiGeneration.LEGACY_STATS, ApiGeneration.RESOURCE_LIST, ApiGeneration.FILE_SERVICE);

    @AssertTrue(message = "metering.collection.cycle-budget must be shorter than metering.collection.interval")
    public boolean isCycleBudgetBelowInterval() {
        return collection.getCycleBudget().compareTo(collection.getInterval()) < 0;
    }

    private static Map<ResourceKind, List<ApiGeneration>> defaultRoutes() {
        var routes = new EnumMap<ResourceKind, List<ApiGeneration>>(ResourceKind.class);
        routes.put(ResourceKind.CLUSTER, List.of(ApiGeneration.LEGACY_STATS, ApiGeneration.RESOURCE_LIST));
        routes.put(ResourceKind.HOST, List.of(ApiGeneration.RESOURCE_LIST));
        routes.put(ResourceKind.VM, List.of(ApiGeneration.RESOURCE_LIST));
        routes.put(ResourceKind.STORAGE_CONTAINER, List.of(ApiGeneration.LEGACY_STATS));
        routes.put(ResourceKind.FILE_SERVER, List.of(ApiGeneration.FILE_SERVICE));
        return routes;
    }

    @Getter
    @Setter
    public static class Prism {
        @NotBlank
        private String host;
        @Min(1)
        private int port = 9440;
        @NotBlank
        private String username;
        @NotBlank
        private String password;
        private boolean verifySsl = false;
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration sessionTtl = Duration.ofMinutes(15);

        public String baseUrl() {
            return "https://" + host + ":" + port;
        }
    }

    @Getter
    @Setter
    public static class Collection {
        @NotNull
        private Duration interval = Duration.ofSeconds(60);
        @NotNull
        private Duration cycleBudget = Duration.ofSeconds(45);
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
        @Min(1)
        private int legacyPageSize = 100;
        @Min(1)
        private int resourceListPageSize = 500;
        @Min(1)
        private int fileServicePageSize = 50;
        @Min(1)
        private int parallelism = 4;
    }

    @Getter
    @Setter
    public static class Auth {
        @Min(1)
        private int maxConsecutiveFailures = 3;
    }

    @Getter
    @Setter
    public static class RateLimit {
        @DecimalMin("0.1")
        private double requestsPerSecond = 10.0;
    }

    @Getter
    @Setter
    public static class Export {
        /**
         * 24h wall-clock time of the daily export, HH:mm.
         */
        @NotBlank
        @Pattern(regexp = "([01]\\d|2[0-3]):[0-5]\\d", message = "must be HH:mm (24h)")
        private String time = "01:00";
        @NotNull
        private Path directory = Path.of("/data/exports");
        @NotBlank
        private String extension = "csv";
        private boolean runOnStartup = false;

        public LocalTime timeOfDay() {
            return LocalTime.parse(time);
        }
    }

    @Getter
    @Setter
    public static class Billing {
        @NotBlank
        private String accountId = DEFAULT_ACCOUNT_ID;
        @NotNull
        private String appId = "";

        public boolean hasConfiguredAccountId() {
            return !DEFAULT_ACCOUNT_ID.equals(accountId);
        }
    }
}
