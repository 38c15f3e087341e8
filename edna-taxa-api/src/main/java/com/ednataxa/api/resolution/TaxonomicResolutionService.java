package com.ednataxa.api.resolution;

import com.ednataxa.api.config.Provider;
import com.ednataxa.api.config.TaxonomyProperties;
import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.OccurrenceRow;
import com.ednataxa.api.model.ResolutionSummary;
import com.ednataxa.api.model.SkipPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Runs one resolution pass: parse and filter each distinct lineage, dispatch, then merge the
 * results back onto every row. Each run gets its own cache.
 */
@Service
public class TaxonomicResolutionService {

    private static final Logger log = LoggerFactory.getLogger(TaxonomicResolutionService.class);

    private final LineageParser parser;
    private final SkipPolicy skipPolicy;
    private final ParallelDispatcher dispatcher;
    private final OccurrenceMerger merger;
    private final Provider provider;

    public TaxonomicResolutionService(LineageParser parser,
                                      SkipPolicy skipPolicy,
                                      ParallelDispatcher dispatcher,
                                      OccurrenceMerger merger,
                                      TaxonomyProperties properties) {
        this.parser = parser;
        this.skipPolicy = skipPolicy;
        this.dispatcher = dispatcher;
        this.merger = merger;
        this.provider = properties.getProvider();
    }

    public ResolutionRun resolve(List<OccurrenceRow> rows) {
        long startNs = System.nanoTime();
        ResolutionCache cache = new ResolutionCache();

        Map<PairKey, LineageQuery> queries = new HashMap<>();
        for (OccurrenceRow row : rows) {
            queries.computeIfAbsent(PairKey.of(row), this::toQuery);
        }
        log.info("Resolving {} row(s) with {} distinct (assay, lineage) pair(s) against {}",
                rows.size(), queries.size(), provider.displayName());

        DispatchReport report = dispatcher.dispatch(queries.values(), cache);
        Map<String, MatchResult> matches = cache.snapshot();
        OccurrenceMerger.MergeCounts counts = merger.merge(rows, row -> queries.get(PairKey.of(row)), matches);

        TreeSet<String> unresolvedLineages = new TreeSet<>();
        int resolvedKeys = 0;
        for (Map.Entry<String, MatchResult> entry : matches.entrySet()) {
            if (entry.getValue().isResolved()) {
                resolvedKeys++;
            }
        }
        for (KeyOutcome outcome : report.outcomes()) {
            if (!outcome.result().isResolved() && outcome.query().verbatimLineage() != null) {
                unresolvedLineages.add(outcome.query().verbatimLineage());
            }
        }
        ResolutionSummary summary = new ResolutionSummary(
                provider.displayName(),
                matches.size(),
                resolvedKeys,
                matches.size() - resolvedKeys,
                report.count(ResolutionPath.CACHE_HIT),
                report.count(ResolutionPath.LOCAL_HIT),
                report.count(ResolutionPath.REMOTE_QUERY),
                counts.resolved(),
                counts.unresolved(),
                new ArrayList<>(unresolvedLineages));
        log.info("Taxonomic resolution finished in {} ms: keys={}, resolved={}, unresolved={}, cacheHits={}, localHits={}, remoteQueries={}",
                (System.nanoTime() - startNs) / 1_000_000L, summary.distinctKeys(), summary.resolved(),
                summary.unresolved(), summary.cacheHits(), summary.localHits(), summary.remoteQueries());
        if (!unresolvedLineages.isEmpty()) {
            log.warn("{} lineage(s) could not be resolved and were given the placeholder identity", unresolvedLineages.size());
        }
        return new ResolutionRun(summary, matches, rows);
    }

    public MatchResult match(String assayName, String lineage) {
        LineageQuery query = toQuery(new PairKey(assayName, lineage));
        return dispatcher.resolve(query, new ResolutionCache()).result();
    }

    private LineageQuery toQuery(PairKey pair) {
        return RankPolicyFilter.filter(parser.parse(pair.assayName(), pair.lineage()), skipPolicy);
    }

    private record PairKey(String assayName, String lineage) {
        static PairKey of(OccurrenceRow row) {
            return new PairKey(row.getAssayName(), row.getVerbatimIdentification());
        }
    }
}
