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
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * World Register of Marine Species lookups through {@code AphiaRecordsByMatchNames}.
 * The first accepted record wins; failing that, the first synonym that points at a valid
 * AphiaID resolves to its accepted taxon.
 */
public class WormsTaxonomySource implements TaxonomySource {

    static final String LSID_PREFIX = "urn:lsid:marinespecies.org:taxname:";

    private final RetryingJsonClient client;
    private final String baseUrl;
    private final boolean marineOnly;

    public WormsTaxonomySource(RetryingJsonClient client, String baseUrl, boolean marineOnly) {
        this.client = client;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.marineOnly = marineOnly;
    }

    @Override
    public MatchResult resolve(LineageQuery query) {
        return RankFallback.walk(query, MatchSource.WORMS, client.newBudget(), this::matchName);
    }

    @Override
    public MatchSource source() {
        return MatchSource.WORMS;
    }

    private Optional<MatchResult> matchName(RankedName entry, BackoffPolicy.RetryBudget budget) {
        URI uri = URI.create(baseUrl + "/AphiaRecordsByMatchNames?scientificnames%5B%5D="
                + Classification.encode(entry.name()) + "&marine_only=" + marineOnly);
        return client.getJson(uri, budget).flatMap(body -> choose(candidates(body)));
    }

    private List<JsonNode> candidates(JsonNode body) {
        JsonNode records = body;
        // one result list per submitted name
        if (body.isArray() && body.size() > 0 && body.get(0).isArray()) {
            records = body.get(0);
        }
        List<JsonNode> out = new ArrayList<>();
        if (records.isArray()) {
            for (JsonNode record : records) {
                if (record != null && record.isObject()) {
                    out.add(record);
                }
            }
        } else if (records.isObject()) {
            out.add(records);
        }
        return out;
    }

    private Optional<MatchResult> choose(List<JsonNode> records) {
        for (JsonNode record : records) {
            if ("accepted".equalsIgnoreCase(Classification.text(record, "status"))) {
                return Optional.of(toAccepted(record));
            }
        }
        for (JsonNode record : records) {
            long validId = record.path("valid_AphiaID").asLong(0L);
            if (validId > 0 && Classification.text(record, "valid_name") != null) {
                return Optional.of(toAcceptedSynonym(record, validId));
            }
        }
        return Optional.empty();
    }

    private MatchResult toAccepted(JsonNode record) {
        String lsid = Classification.text(record, "lsid");
        if (lsid == null) {
            lsid = LSID_PREFIX + record.path("AphiaID").asLong();
        }
        MatchType type = "exact".equalsIgnoreCase(Classification.text(record, "match_type")) ? MatchType.EXACT : MatchType.FUZZY;
        return MatchResult.matched(null, rank(record), Classification.text(record, "scientificname"), lsid,
                type, MatchSource.WORMS, Classification.fromNode(record));
    }

    private MatchResult toAcceptedSynonym(JsonNode record, long validId) {
        return MatchResult.matched(null, rank(record), Classification.text(record, "valid_name"), LSID_PREFIX + validId,
                MatchType.ACCEPTED_SYNONYM, MatchSource.WORMS, Classification.fromNode(record));
    }

    private static String rank(JsonNode record) {
        String rank = Classification.text(record, "rank");
        return rank == null ? null : rank.toLowerCase(Locale.ROOT);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
