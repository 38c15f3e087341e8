package com.ednataxa.api.resolution;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.RankedName;
import com.ednataxa.api.model.SkipPolicy;

import java.util.List;

/**
 * Drops the species entry for assays whose species-level assignments are not trusted.
 * Must be applied before the query's canonical key is used.
 */
public final class RankPolicyFilter {

    private RankPolicyFilter() {
    }

    public static LineageQuery filter(LineageQuery query, SkipPolicy policy) {
        if (!policy.suppressesSpecies(query.assayName())) {
            return query;
        }
        List<RankedName> kept = query.entries().stream()
                .filter(entry -> !entry.isSpecies())
                .toList();
        return query.withEntries(kept, true);
    }
}
