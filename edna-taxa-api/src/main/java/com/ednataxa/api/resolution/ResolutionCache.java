package com.ednataxa.api.resolution;

import com.ednataxa.api.model.MatchResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Canonical key to result map for a single run. Create one per run and drop it afterwards.
 * <p>
 * Inserts are first-writer-wins. {@link #computeIfAbsent} claims the key before loading, so
 * concurrent callers for the same key wait for the claimant instead of repeating the remote
 * lookup, and no map lock is held while the loader runs.
 */
public class ResolutionCache {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

    private final Cache<String, MatchResult> results = Caffeine.newBuilder().build();
    private final ConcurrentMap<String, CompletableFuture<MatchResult>> inFlight = new ConcurrentHashMap<>();

    public record Lookup(MatchResult result, boolean loaded) {}

    public Optional<MatchResult> getIfPresent(String key) {
        return Optional.ofNullable(results.getIfPresent(key));
    }

    /**
     * @return the value now held for the key, which is the earlier one if another writer won
     */
    public MatchResult put(String key, MatchResult result) {
        MatchResult previous = results.asMap().putIfAbsent(key, result);
        return previous != null ? previous : result;
    }

    public Lookup computeIfAbsent(String key, Function<String, MatchResult> loader) {
        MatchResult cached = results.getIfPresent(key);
        if (cached != null) {
            return new Lookup(cached, false);
        }
        CompletableFuture<MatchResult> claim = new CompletableFuture<>();
        CompletableFuture<MatchResult> existing = inFlight.putIfAbsent(key, claim);
        if (existing != null) {
            log.debug("Key '{}' already claimed by another worker; waiting", key);
            return new Lookup(existing.join(), false);
        }
        try {
            // the previous claimant may have finished between the read and the claim
            MatchResult raced = results.asMap().get(key);
            if (raced != null) {
                claim.complete(raced);
                return new Lookup(raced, false);
            }
            MatchResult stored = put(key, loader.apply(key));
            claim.complete(stored);
            return new Lookup(stored, true);
        } catch (RuntimeException | Error e) {
            claim.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, claim);
        }
    }

    public long size() {
        return results.estimatedSize();
    }

    /** Sorted copy of the current content. */
    public Map<String, MatchResult> snapshot() {
        return new TreeMap<>(results.asMap());
    }
}
