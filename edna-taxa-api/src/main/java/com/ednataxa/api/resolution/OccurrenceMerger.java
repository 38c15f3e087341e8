package com.ednataxa.api.resolution;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.OccurrenceRow;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Copies resolved identities back onto occurrence rows. Rows without a resolved key get the
 * placeholder identity so that no row leaves this stage without a name and identifier.
 */
public class OccurrenceMerger {

    private final String placeholderName;
    private final String placeholderIdentifier;
    private final String nameAccordingTo;

    public OccurrenceMerger(String placeholderName, String placeholderIdentifier, String nameAccordingTo) {
        this.placeholderName = placeholderName;
        this.placeholderIdentifier = placeholderIdentifier;
        this.nameAccordingTo = nameAccordingTo;
    }

    public MergeCounts merge(List<OccurrenceRow> rows,
                             Function<OccurrenceRow, LineageQuery> queryOf,
                             Map<String, MatchResult> resolved) {
        int ok = 0;
        int unresolved = 0;
        for (OccurrenceRow row : rows) {
            LineageQuery query = queryOf.apply(row);
            MatchResult result = resolved.get(query.canonicalKey());
            row.setCleanedTaxonomy(query.cleanedTaxonomy());
            if (result != null && result.isResolved()) {
                applyMatch(row, result);
                ok++;
            } else {
                applyPlaceholder(row, result);
                unresolved++;
            }
        }
        return new MergeCounts(ok, unresolved);
    }

    private void applyMatch(OccurrenceRow row, MatchResult result) {
        row.setScientificName(result.matchedName());
        row.setScientificNameID(result.identifier());
        row.setTaxonRank(result.matchedRank());
        row.setNameAccordingTo(nameAccordingTo);
        row.setIdentificationRemarks("Taxonomic match: " + result.matchType().label() + " via " + result.source().label());
        Map<String, String> classification = result.classification();
        row.setKingdom(classification.get("kingdom"));
        row.setPhylum(classification.get("phylum"));
        row.setClazz(classification.get("class"));
        row.setOrder(classification.get("order"));
        row.setFamily(classification.get("family"));
        row.setGenus(classification.get("genus"));
    }

    private void applyPlaceholder(OccurrenceRow row, MatchResult result) {
        row.setScientificName(placeholderName);
        row.setScientificNameID(placeholderIdentifier);
        row.setTaxonRank(null);
        row.setNameAccordingTo(nameAccordingTo);
        String cause = result == null || result.failureCause() == null
                ? "not resolved"
                : result.failureCause().name().toLowerCase(Locale.ROOT).replace('_', ' ');
        String via = result == null || result.source() == null ? "" : " via " + result.source().label();
        row.setIdentificationRemarks("Taxonomic match: no-match (" + cause + ")" + via);
    }

    public record MergeCounts(int resolved, int unresolved) {}
}
