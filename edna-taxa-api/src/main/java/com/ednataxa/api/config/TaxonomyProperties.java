package com.ednataxa.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "taxonomy")
public class TaxonomyProperties {

    @NotNull
    private Provider provider = Provider.WORMS;

    @NotEmpty
    private List<String> defaultRanks = new ArrayList<>(List.of(
            "kingdom", "phylum", "class", "order", "family", "genus", "species"));

    private Map<String, List<String>> assayRanks = new LinkedHashMap<>();

    private List<String> skipSpeciesAssays = new ArrayList<>();

    private List<String> incertaeSedisLineages = new ArrayList<>(List.of("eukaryota"));

    @Valid
    private WormsProperties worms = new WormsProperties();
    @Valid
    private GbifProperties gbif = new GbifProperties();
    @Valid
    private LocalReferenceProperties localReference = new LocalReferenceProperties();
    @Valid
    private RetryProperties retry = new RetryProperties();
    @Valid
    private HttpProperties http = new HttpProperties();
    @Valid
    private UnresolvedProperties unresolved = new UnresolvedProperties();

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public List<String> getDefaultRanks() {
        return defaultRanks;
    }

    public void setDefaultRanks(List<String> defaultRanks) {
        this.defaultRanks = defaultRanks;
    }

    public Map<String, List<String>> getAssayRanks() {
        return assayRanks;
    }

    public void setAssayRanks(Map<String, List<String>> assayRanks) {
        this.assayRanks = assayRanks;
    }

    public List<String> getSkipSpeciesAssays() {
        return skipSpeciesAssays;
    }

    public void setSkipSpeciesAssays(List<String> skipSpeciesAssays) {
        this.skipSpeciesAssays = skipSpeciesAssays;
    }

    public List<String> getIncertaeSedisLineages() {
        return incertaeSedisLineages;
    }

    public void setIncertaeSedisLineages(List<String> incertaeSedisLineages) {
        this.incertaeSedisLineages = incertaeSedisLineages;
    }

    public WormsProperties getWorms() {
        return worms;
    }

    public void setWorms(WormsProperties worms) {
        this.worms = worms;
    }

    public GbifProperties getGbif() {
        return gbif;
    }

    public void setGbif(GbifProperties gbif) {
        this.gbif = gbif;
    }

    public LocalReferenceProperties getLocalReference() {
        return localReference;
    }

    public void setLocalReference(LocalReferenceProperties localReference) {
        this.localReference = localReference;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public HttpProperties getHttp() {
        return http;
    }

    public void setHttp(HttpProperties http) {
        this.http = http;
    }

    public UnresolvedProperties getUnresolved() {
        return unresolved;
    }

    public void setUnresolved(UnresolvedProperties unresolved) {
        this.unresolved = unresolved;
    }

    /** Worker pool size of the selected provider, 0 meaning all available processors. */
    public int workersFor(Provider selected) {
        ProviderProperties cfg = selected == Provider.GBIF ? gbif : worms;
        int workers = cfg.getWorkers() > 0 ? cfg.getWorkers() : Runtime.getRuntime().availableProcessors();
        if (cfg.getMaxWorkers() > 0) {
            workers = Math.min(workers, cfg.getMaxWorkers());
        }
        return Math.max(workers, 1);
    }

    public static class ProviderProperties {
        @Min(0)
        private int workers = 0;
        @Min(0)
        private int maxWorkers = 0;
        @NotBlank
        private String baseUrl;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class WormsProperties extends ProviderProperties {
        private boolean marineOnly = false;

        public WormsProperties() {
            setBaseUrl("https://www.marinespecies.org/rest");
        }

        public boolean isMarineOnly() {
            return marineOnly;
        }

        public void setMarineOnly(boolean marineOnly) {
            this.marineOnly = marineOnly;
        }
    }

    public static class GbifProperties extends ProviderProperties {
        @Min(0)
        @Max(100)
        private int minConfidence = 80;

        public GbifProperties() {
            setBaseUrl("https://api.gbif.org/v1");
        }

        public int getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(int minConfidence) {
            this.minConfidence = minConfidence;
        }
    }

    public static class LocalReferenceProperties {
        private boolean enabled = false;
        private String path;
        @NotNull
        private DatasetFormat format = DatasetFormat.TSV;
        private String checksum;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public DatasetFormat getFormat() {
            return format;
        }

        public void setFormat(DatasetFormat format) {
            this.format = format;
        }

        public String getChecksum() {
            return checksum;
        }

        public void setChecksum(String checksum) {
            this.checksum = checksum;
        }
    }

    public static class RetryProperties {
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(20);
        @DecimalMin("1.0")
        private double multiplier = 2.0d;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.25d;
        @NotNull
        private Duration maxRetryBudget = Duration.ofMinutes(2);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getMaxRetryBudget() {
            return maxRetryBudget;
        }

        public void setMaxRetryBudget(Duration maxRetryBudget) {
            this.maxRetryBudget = maxRetryBudget;
        }
    }

    public static class HttpProperties {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String userAgent = "edna-taxa/0.1";

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class UnresolvedProperties {
        @NotBlank
        private String name = "incertae sedis";
        @NotBlank
        private String identifier = "urn:lsid:marinespecies.org:taxname:12";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }
    }
}
