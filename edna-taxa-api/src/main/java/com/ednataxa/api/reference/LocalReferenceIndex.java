package com.ednataxa.api.reference;

import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.MatchSource;
import com.ednataxa.api.model.MatchType;
import com.ednataxa.api.util.ScientificNames;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, exact-match name index over a pre-resolved reference taxonomy.
 */
public final class LocalReferenceIndex {

    private static final LocalReferenceIndex DISABLED = new LocalReferenceIndex(Map.of(), false, null);

    private final Map<String, LocalReferenceEntry> byName;
    private final boolean enabled;
    private final String location;

    private LocalReferenceIndex(Map<String, LocalReferenceEntry> byName, boolean enabled, String location) {
        this.byName = Map.copyOf(byName);
        this.enabled = enabled;
        this.location = location;
    }

    public static LocalReferenceIndex disabled() {
        return DISABLED;
    }

    public static LocalReferenceIndex of(Map<String, LocalReferenceEntry> byNormalizedName, String location) {
        return new LocalReferenceIndex(byNormalizedName, true, location);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int size() {
        return byName.size();
    }

    public String location() {
        return location;
    }

    public Optional<LocalReferenceEntry> lookup(String scientificName) {
        if (!enabled) {
            return Optional.empty();
        }
        String key = ScientificNames.normalize(scientificName);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(key));
    }

    /**
     * A row naming an accepted taxon is reported under that taxon, with its identifier taken from
     * the row's accepted identifier or from the accepted taxon's own row. When neither is known the
     * row is reported as an exact match on its own name, so the identifier always belongs to the
     * reported name.
     */
    public Optional<MatchResult> match(String scientificName, String canonicalKey) {
        return lookup(scientificName).map(entry -> toMatchResult(entry, canonicalKey));
    }

    private MatchResult toMatchResult(LocalReferenceEntry entry, String canonicalKey) {
        String accepted = entry.acceptedName();
        if (accepted == null || accepted.equalsIgnoreCase(entry.scientificName())) {
            return matched(entry, entry.scientificName(), entry.scientificNameID(), MatchType.EXACT, canonicalKey);
        }
        if (entry.acceptedNameID() != null) {
            return matched(entry, accepted, entry.acceptedNameID(), MatchType.ACCEPTED_SYNONYM, canonicalKey);
        }
        Optional<LocalReferenceEntry> acceptedEntry = lookup(accepted);
        if (acceptedEntry.isPresent()) {
            LocalReferenceEntry target = acceptedEntry.get();
            return matched(target, target.scientificName(), target.scientificNameID(),
                    MatchType.ACCEPTED_SYNONYM, canonicalKey);
        }
        return matched(entry, entry.scientificName(), entry.scientificNameID(), MatchType.EXACT, canonicalKey);
    }

    private static MatchResult matched(LocalReferenceEntry entry, String name, String identifier,
                                       MatchType matchType, String canonicalKey) {
        String rank = entry.taxonRank() == null ? null : entry.taxonRank().toLowerCase(Locale.ROOT);
        return MatchResult.matched(canonicalKey, rank, name, identifier, matchType, MatchSource.LOCAL,
                entry.classification());
    }
}
