package com.ednataxa.api.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One distinct (assay, lineage) pair ready for resolution. Entries run from the coarsest
 * rank to the finest one. The canonical key reflects the entries after rank policy filtering
 * and whether the species-skip policy applied.
 */
public record LineageQuery(
        String assayName,
        String verbatimLineage,
        List<RankedName> entries,
        boolean speciesSuppressed
) {

    public static final String SUPPRESSED_SUFFIX = "#species-suppressed";

    public LineageQuery {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public String canonicalKey() {
        String key = entries.stream()
                .map(RankedName::keyPart)
                .collect(Collectors.joining(";"));
        return speciesSuppressed ? key + SUPPRESSED_SUFFIX : key;
    }

    public Optional<RankedName> finest() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(entries.size() - 1));
    }

    public String cleanedTaxonomy() {
        return entries.stream()
                .map(RankedName::name)
                .collect(Collectors.joining(";"));
    }

    public LineageQuery withEntries(List<RankedName> newEntries, boolean suppressed) {
        return new LineageQuery(assayName, verbatimLineage, newEntries, suppressed);
    }
}
