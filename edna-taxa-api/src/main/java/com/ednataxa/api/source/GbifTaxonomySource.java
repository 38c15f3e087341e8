package com.ednataxa.api.source;

import com.ednataxa.api.http.BackoffPolicy;
import com.ednataxa.api.http.RetryingJsonClient;
import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.MatchSource;
import com.ednataxa.api.model.MatchType;
import com.ednataxa.api.model.RankedName;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * GBIF backbone lookups through {@code /species/match}. Each rank is requested explicitly,
 * so HIGHERRANK answers are ignored and the walk moves on to the next coarser entry itself.
 */
public class GbifTaxonomySource implements TaxonomySource {

    static final String SPECIES_URL_PREFIX = "https://www.gbif.org/species/";

    private static final Set<String> GBIF_RANKS = Set.of(
            "kingdom", "phylum", "class", "order", "family", "genus", "species");

    private final RetryingJsonClient client;
    private final String baseUrl;
    private final int minConfidence;

    public GbifTaxonomySource(RetryingJsonClient client, String baseUrl, int minConfidence) {
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.minConfidence = minConfidence;
    }

    @Override
    public MatchResult resolve(LineageQuery query) {
        return RankFallback.walk(query, MatchSource.GBIF, client.newBudget(),
                (entry, budget) -> matchName(query, entry, budget));
    }

    @Override
    public MatchSource source() {
        return MatchSource.GBIF;
    }

    private Optional<MatchResult> matchName(LineageQuery query, RankedName entry, BackoffPolicy.RetryBudget budget) {
        String requestedRank = GBIF_RANKS.contains(entry.rank()) ? entry.rank() : null;
        URI uri = URI.create(buildMatchUrl(query, entry, requestedRank));
        return client.getJson(uri, budget).flatMap(body -> choose(body, requestedRank));
    }

    private String buildMatchUrl(LineageQuery query, RankedName entry, String requestedRank) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/species/match?name=").append(Classification.encode(entry.name()))
                .append("&strict=false&verbose=true");
        if (requestedRank != null) {
            url.append("&rank=").append(requestedRank.toUpperCase(Locale.ROOT));
        }
        for (RankedName coarser : query.entries()) {
            if (coarser == entry) {
                break;
            }
            if (Classification.HIGHER_RANKS.contains(coarser.rank())) {
                url.append('&').append(coarser.rank()).append('=').append(Classification.encode(coarser.name()));
            }
        }
        return url.toString();
    }

    private Optional<MatchResult> choose(JsonNode body, String requestedRank) {
        List<JsonNode> candidates = new ArrayList<>();
        candidates.add(body);
        JsonNode alternatives = body.get("alternatives");
        if (alternatives != null && alternatives.isArray()) {
            alternatives.forEach(candidates::add);
        }
        // stable sort keeps GBIF's own ordering among equals
        return candidates.stream()
                .filter(c -> usable(c, requestedRank))
                .sorted(Comparator.comparing((JsonNode c) -> !isAccepted(c))
                        .thenComparing(c -> -c.path("confidence").asInt(0)))
                .map(this::toResult)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private boolean usable(JsonNode candidate, String requestedRank) {
        String matchType = Classification.text(candidate, "matchType");
        if (!"EXACT".equals(matchType) && !"FUZZY".equals(matchType)) {
            return false;
        }
        if (!candidate.hasNonNull("usageKey") || candidate.path("confidence").asInt(0) < minConfidence) {
            return false;
        }
        String rank = Classification.text(candidate, "rank");
        return requestedRank == null || requestedRank.equalsIgnoreCase(rank);
    }

    private static boolean isAccepted(JsonNode candidate) {
        return "ACCEPTED".equals(Classification.text(candidate, "status")) && !candidate.path("synonym").asBoolean(false);
    }

    private Optional<MatchResult> toResult(JsonNode candidate) {
        String rank = Optional.ofNullable(Classification.text(candidate, "rank"))
                .map(r -> r.toLowerCase(Locale.ROOT))
                .orElse(null);
        String name = Optional.ofNullable(Classification.text(candidate, "canonicalName"))
                .orElseGet(() -> Classification.text(candidate, "scientificName"));
        boolean synonym = candidate.path("synonym").asBoolean(false)
                || String.valueOf(Classification.text(candidate, "status")).contains("SYNONYM");
        if (!synonym) {
            MatchType type = "EXACT".equals(Classification.text(candidate, "matchType")) ? MatchType.EXACT : MatchType.FUZZY;
            return Optional.of(MatchResult.matched(null, rank, name,
                    SPECIES_URL_PREFIX + candidate.path("usageKey").asLong(), type, MatchSource.GBIF,
                    Classification.fromNode(candidate)));
        }
        if (!candidate.hasNonNull("acceptedUsageKey")) {
            return Optional.empty();
        }
        // the classification fields of a synonym describe its accepted taxon
        String acceptedName = rank != null && Classification.text(candidate, rank) != null
                ? Classification.text(candidate, rank)
                : name;
        return Optional.of(MatchResult.matched(null, rank, acceptedName,
                SPECIES_URL_PREFIX + candidate.path("acceptedUsageKey").asLong(), MatchType.ACCEPTED_SYNONYM,
                MatchSource.GBIF, Classification.fromNode(candidate)));
    }
}
