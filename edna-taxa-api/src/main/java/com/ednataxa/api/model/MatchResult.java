package com.ednataxa.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchResult(
        String canonicalKey,
        String matchedRank,
        String matchedName,
        String identifier,
        MatchType matchType,
        MatchSource source,
        Map<String, String> classification,
        FailureCause failureCause,
        String failureDetail
) {

    public MatchResult {
        classification = classification == null ? Map.of() : Map.copyOf(classification);
    }

    public static MatchResult matched(String canonicalKey, String rank, String name, String identifier,
                                      MatchType matchType, MatchSource source, Map<String, String> classification) {
        return new MatchResult(canonicalKey, rank, name, identifier, matchType, source, classification, null, null);
    }

    public static MatchResult noMatch(String canonicalKey, MatchSource source, FailureCause cause, String detail) {
        return new MatchResult(canonicalKey, null, null, null, MatchType.NO_MATCH, source, Map.of(), cause, detail);
    }

    public boolean isResolved() {
        return matchType != MatchType.NO_MATCH;
    }

    public boolean isSpeciesRank() {
        return RankedName.SPECIES.equalsIgnoreCase(matchedRank);
    }

    public MatchResult withCanonicalKey(String key) {
        return new MatchResult(key, matchedRank, matchedName, identifier, matchType, source, classification,
                failureCause, failureDetail);
    }
}
