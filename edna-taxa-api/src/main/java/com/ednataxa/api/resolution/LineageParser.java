package com.ednataxa.api.resolution;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.RankedName;
import com.ednataxa.api.util.ScientificNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits a semicolon separated lineage into ranked names. Ranks come from the position of each
 * segment in the assay's rank layout, so dropped segments (blank, "unassigned", ...) keep their
 * slot and a species entry only exists for full-length lineages.
 */
public class LineageParser {

    static final String UNRANKED = "unranked";

    private final List<String> defaultRanks;
    private final Map<String, List<String>> assayRanks;

    public LineageParser(List<String> defaultRanks, Map<String, List<String>> assayRanks) {
        this.defaultRanks = normalize(defaultRanks);
        this.assayRanks = assayRanks == null ? Map.of() : Map.copyOf(assayRanks);
    }

    public LineageQuery parse(String assayName, String verbatimLineage) {
        if (verbatimLineage == null || verbatimLineage.isBlank()) {
            return new LineageQuery(assayName, verbatimLineage, List.of(), false);
        }
        List<String> ranks = ranksFor(assayName);
        String[] segments = verbatimLineage.split(";", -1);
        List<RankedName> entries = new ArrayList<>(segments.length);
        for (int i = 0; i < segments.length; i++) {
            String name = ScientificNames.clean(segments[i]);
            if (name == null) {
                continue;
            }
            String rank = i < ranks.size() ? ranks.get(i) : UNRANKED;
            entries.add(new RankedName(rank, name));
        }
        return new LineageQuery(assayName, verbatimLineage, entries, false);
    }

    List<String> ranksFor(String assayName) {
        List<String> configured = assayName == null ? null : assayRanks.get(assayName);
        return configured == null || configured.isEmpty() ? defaultRanks : normalize(configured);
    }

    private static List<String> normalize(List<String> ranks) {
        return ranks.stream()
                .map(r -> r.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
