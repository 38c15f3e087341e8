package com.ednataxa.api.config;

import com.ednataxa.api.http.BackoffPolicy;
import com.ednataxa.api.http.HttpTransport;
import com.ednataxa.api.http.JdkHttpTransport;
import com.ednataxa.api.http.RetryingJsonClient;
import com.ednataxa.api.metrics.ResolutionMetrics;
import com.ednataxa.api.model.SkipPolicy;
import com.ednataxa.api.reference.LocalReferenceIndex;
import com.ednataxa.api.reference.LocalReferenceLoader;
import com.ednataxa.api.resolution.LineageParser;
import com.ednataxa.api.resolution.OccurrenceMerger;
import com.ednataxa.api.resolution.ParallelDispatcher;
import com.ednataxa.api.source.GbifTaxonomySource;
import com.ednataxa.api.source.TaxonomySource;
import com.ednataxa.api.source.WormsTaxonomySource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(TaxonomyProperties.class)
public class TaxonomyConfig {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyConfig.class);

    @Bean
    public HttpClient taxonomyHttpClient(TaxonomyProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public HttpTransport httpTransport(HttpClient taxonomyHttpClient, TaxonomyProperties properties) {
        return new JdkHttpTransport(taxonomyHttpClient, properties.getHttp().getUserAgent());
    }

    @Bean
    public BackoffPolicy backoffPolicy(TaxonomyProperties properties) {
        TaxonomyProperties.RetryProperties retry = properties.getRetry();
        return new BackoffPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMaxBackoff(),
                retry.getMultiplier(), retry.getJitter(), retry.getMaxRetryBudget());
    }

    @Bean
    public RetryingJsonClient retryingJsonClient(HttpTransport httpTransport, ObjectMapper objectMapper,
                                                 BackoffPolicy backoffPolicy, ResolutionMetrics metrics,
                                                 TaxonomyProperties properties) {
        return new RetryingJsonClient(httpTransport, objectMapper, backoffPolicy,
                properties.getHttp().getRequestTimeout(), (uri, attempt, wait) -> metrics.recordRetry());
    }

    @Bean
    public TaxonomySource taxonomySource(RetryingJsonClient client, TaxonomyProperties properties) {
        switch (properties.getProvider()) {
            case GBIF:
                return new GbifTaxonomySource(client, properties.getGbif().getBaseUrl(),
                        properties.getGbif().getMinConfidence());
            case WORMS:
            default:
                return new WormsTaxonomySource(client, properties.getWorms().getBaseUrl(),
                        properties.getWorms().isMarineOnly());
        }
    }

    @Bean
    public LocalReferenceLoader localReferenceLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new LocalReferenceLoader(resourceLoader, objectMapper);
    }

    /**
     * Loaded once at startup. A configured dataset that cannot be read fails the context.
     */
    @Bean
    public LocalReferenceIndex localReferenceIndex(LocalReferenceLoader loader, TaxonomyProperties properties) {
        TaxonomyProperties.LocalReferenceProperties cfg = properties.getLocalReference();
        if (!cfg.isEnabled()) {
            log.info("Local reference dataset disabled");
            return LocalReferenceIndex.disabled();
        }
        if (properties.getProvider() != Provider.WORMS) {
            log.warn("Local reference dataset is only used with the WoRMS provider; ignoring it for {}",
                    properties.getProvider().displayName());
            return LocalReferenceIndex.disabled();
        }
        return loader.load(cfg);
    }

    @Bean
    public LineageParser lineageParser(TaxonomyProperties properties) {
        return new LineageParser(properties.getDefaultRanks(), properties.getAssayRanks());
    }

    @Bean
    public SkipPolicy skipPolicy(TaxonomyProperties properties) {
        return SkipPolicy.of(properties.getSkipSpeciesAssays());
    }

    @Bean
    public ParallelDispatcher parallelDispatcher(TaxonomySource taxonomySource,
                                                 LocalReferenceIndex localReferenceIndex,
                                                 ResolutionMetrics metrics,
                                                 TaxonomyProperties properties) {
        int workers = properties.workersFor(properties.getProvider());
        log.info("Taxonomy provider {} with {} worker(s)", properties.getProvider().displayName(), workers);
        return new ParallelDispatcher(taxonomySource, localReferenceIndex,
                properties.getIncertaeSedisLineages(), workers, metrics);
    }

    @Bean
    public OccurrenceMerger occurrenceMerger(TaxonomyProperties properties) {
        return new OccurrenceMerger(properties.getUnresolved().getName(), properties.getUnresolved().getIdentifier(),
                properties.getProvider().displayName());
    }
}
