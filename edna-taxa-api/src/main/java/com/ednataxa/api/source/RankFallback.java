package com.ednataxa.api.source;

import com.ednataxa.api.http.BackoffPolicy;
import com.ednataxa.api.http.PermanentApiException;
import com.ednataxa.api.http.RetriesExhaustedException;
import com.ednataxa.api.model.FailureCause;
import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.MatchSource;
import com.ednataxa.api.model.RankedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Walks a lineage from its finest entry toward the coarsest one, returning the first match.
 */
final class RankFallback {

    private static final Logger log = LoggerFactory.getLogger(RankFallback.class);

    @FunctionalInterface
    interface NameLookup {
        Optional<MatchResult> lookup(RankedName entry, BackoffPolicy.RetryBudget budget);
    }

    private RankFallback() {
    }

    static MatchResult walk(LineageQuery query, MatchSource source, BackoffPolicy.RetryBudget budget, NameLookup lookup) {
        String key = query.canonicalKey();
        if (query.isEmpty()) {
            return MatchResult.noMatch(key, source, FailureCause.INPUT_ERROR, "Lineage has no usable names");
        }
        List<RankedName> entries = query.entries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            RankedName entry = entries.get(i);
            Optional<MatchResult> match;
            try {
                match = lookup.lookup(entry, budget);
            } catch (RetriesExhaustedException e) {
                log.warn("Giving up on lineage '{}' at {} '{}': {}", query.verbatimLineage(), entry.rank(), entry.name(), e.getMessage());
                return MatchResult.noMatch(key, source, FailureCause.RETRIES_EXHAUSTED, e.getMessage());
            } catch (PermanentApiException e) {
                log.warn("Non-retryable {} error for lineage '{}' at {} '{}': {}",
                        source.label(), query.verbatimLineage(), entry.rank(), entry.name(), e.getMessage());
                return MatchResult.noMatch(key, source, FailureCause.PERMANENT_API_ERROR, e.getMessage());
            }
            if (match.isEmpty()) {
                continue;
            }
            MatchResult result = match.get();
            if (query.speciesSuppressed() && result.isSpeciesRank()) {
                log.debug("Discarding species-rank match '{}' for species-suppressed assay {}", result.matchedName(), query.assayName());
                continue;
            }
            return result.withCanonicalKey(key);
        }
        return MatchResult.noMatch(key, source, FailureCause.NOT_FOUND, "No match at any rank");
    }
}
