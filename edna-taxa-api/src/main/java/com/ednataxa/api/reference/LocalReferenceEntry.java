package com.ednataxa.api.reference;

import java.util.Map;

public record LocalReferenceEntry(
        String scientificName,
        String scientificNameID,
        String acceptedName,
        String acceptedNameID,
        String taxonRank,
        Map<String, String> classification
) {
    public LocalReferenceEntry {
        classification = classification == null ? Map.of() : Map.copyOf(classification);
    }
}
