package com.ednataxa.api.source;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.MatchSource;

/**
 * Resolves one filtered lineage against a backbone taxonomy. Implementations never throw
 * for per-lineage failures; those come back as a {@code no-match} result carrying the cause.
 */
public interface TaxonomySource {

    MatchResult resolve(LineageQuery query);

    MatchSource source();
}
