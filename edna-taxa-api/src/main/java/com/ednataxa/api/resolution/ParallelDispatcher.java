package com.ednataxa.api.resolution;

import com.ednataxa.api.metrics.ResolutionMetrics;
import com.ednataxa.api.model.FailureCause;
import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.RankedName;
import com.ednataxa.api.reference.LocalReferenceIndex;
import com.ednataxa.api.source.TaxonomySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Resolves distinct lineage queries on a fixed worker pool. Each query goes through the run
 * cache, then the local reference index, then the backbone source; every result, no-match
 * included, lands in the cache. {@link #dispatch} returns only once all queries are terminal.
 */
public class ParallelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ParallelDispatcher.class);
    private static final int PROGRESS_EVERY = 500;

    private final TaxonomySource source;
    private final LocalReferenceIndex localIndex;
    private final Set<String> incertaeSedisNames;
    private final int workers;
    private final ResolutionMetrics metrics;

    public ParallelDispatcher(TaxonomySource source,
                              LocalReferenceIndex localIndex,
                              Collection<String> incertaeSedisNames,
                              int workers,
                              ResolutionMetrics metrics) {
        this.source = source;
        this.localIndex = localIndex;
        this.incertaeSedisNames = incertaeSedisNames == null ? Set.of() : incertaeSedisNames.stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.workers = Math.max(workers, 1);
        this.metrics = metrics;
    }

    public DispatchReport dispatch(Collection<LineageQuery> queries, ResolutionCache cache) {
        List<LineageQuery> distinct = new ArrayList<>(new LinkedHashSet<>(queries));
        int size = distinct.size();
        if (size == 0) {
            return new DispatchReport(List.of());
        }
        int poolSize = Math.min(workers, size);
        long startNs = System.nanoTime();
        log.info("Dispatching {} distinct lineage(s) to {} {} worker(s)", size, poolSize, source.source().label());

        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            AtomicInteger completed = new AtomicInteger(0);
            List<CompletableFuture<KeyOutcome>> futures = new ArrayList<>(size);
            for (LineageQuery query : distinct) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return resolve(query, cache);
                    } finally {
                        int done = completed.incrementAndGet();
                        if (done == size || done % PROGRESS_EVERY == 0) {
                            log.info("Taxonomic resolution progress: {}/{}", done, size);
                        }
                    }
                }, pool).handle((outcome, failure) -> failure == null
                        ? outcome
                        : workerFailure(query, cache, unwrap(failure))));
            }
            List<KeyOutcome> outcomes = new ArrayList<>(size);
            for (CompletableFuture<KeyOutcome> future : futures) {
                outcomes.add(future.join());
            }
            log.info("Dispatch complete: {} lineage(s) in {} ms",
                    size, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
            return new DispatchReport(outcomes);
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Resolves one query synchronously through the same cache, local index and source chain.
     */
    public KeyOutcome resolve(LineageQuery query, ResolutionCache cache) {
        String key = query.canonicalKey();
        Optional<MatchResult> cached = cache.getIfPresent(key);
        if (cached.isPresent()) {
            return record(new KeyOutcome(query, cached.get(), ResolutionPath.CACHE_HIT));
        }
        AtomicReference<ResolutionPath> path = new AtomicReference<>(ResolutionPath.CACHE_HIT);
        try {
            ResolutionCache.Lookup lookup = cache.computeIfAbsent(key, k -> load(query, k, path));
            ResolutionPath via = lookup.loaded() ? path.get() : ResolutionPath.CACHE_HIT;
            return record(new KeyOutcome(query, lookup.result(), via));
        } catch (RuntimeException e) {
            return workerFailure(query, cache, e);
        }
    }

    /**
     * Ends the key as a WORKER_FAILURE no-match. Errors thrown on a worker thread land here too,
     * so the join barrier in {@link #dispatch} always completes.
     */
    private KeyOutcome workerFailure(LineageQuery query, ResolutionCache cache, Throwable e) {
        log.error("Worker failed resolving lineage '{}' (assay {})", query.verbatimLineage(), query.assayName(), e);
        String key = query.canonicalKey();
        String detail = e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
        MatchResult failed = cache.put(key, MatchResult.noMatch(key, source.source(), FailureCause.WORKER_FAILURE, detail));
        return record(new KeyOutcome(query, failed, ResolutionPath.WORKER_FAILURE));
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private MatchResult load(LineageQuery query, String key, AtomicReference<ResolutionPath> path) {
        if (query.isEmpty()) {
            path.set(ResolutionPath.SHORT_CIRCUIT);
            return MatchResult.noMatch(key, source.source(), FailureCause.INPUT_ERROR, "Empty or unassigned lineage");
        }
        if (isIncertaeSedis(query)) {
            path.set(ResolutionPath.SHORT_CIRCUIT);
            return MatchResult.noMatch(key, source.source(), FailureCause.INCERTAE_SEDIS,
                    "Lineage only names " + query.cleanedTaxonomy());
        }
        Optional<MatchResult> local = query.finest()
                .flatMap(finest -> localIndex.match(finest.name(), key))
                .filter(match -> !(query.speciesSuppressed() && match.isSpeciesRank()));
        if (local.isPresent()) {
            path.set(ResolutionPath.LOCAL_HIT);
            return local.get();
        }
        path.set(ResolutionPath.REMOTE_QUERY);
        log.debug("Cache miss for '{}'; querying {}", key, source.source().label());
        return metrics.timeRemote(() -> source.resolve(query));
    }

    private boolean isIncertaeSedis(LineageQuery query) {
        List<RankedName> entries = query.entries();
        return entries.size() == 1
                && incertaeSedisNames.contains(entries.get(0).name().toLowerCase(Locale.ROOT));
    }

    private KeyOutcome record(KeyOutcome outcome) {
        metrics.record(outcome.path(), outcome.result().isResolved());
        return outcome;
    }
}
