package com.ednataxa.api.model;

import java.util.List;

public record ResolutionSummary(
        String provider,
        int distinctKeys,
        int resolved,
        int unresolved,
        int cacheHits,
        int localHits,
        int remoteQueries,
        int rowsResolved,
        int rowsUnresolved,
        List<String> unresolvedLineages
) {

    public ResolutionSummary {
        unresolvedLineages = unresolvedLineages == null ? List.of() : List.copyOf(unresolvedLineages);
    }
}
