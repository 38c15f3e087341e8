package com.ednataxa.api.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Classification {

    static final List<String> HIGHER_RANKS = List.of("kingdom", "phylum", "class", "order", "family", "genus");

    private Classification() {
    }

    static Map<String, String> fromNode(JsonNode node) {
        Map<String, String> classification = new LinkedHashMap<>();
        for (String rank : HIGHER_RANKS) {
            String value = text(node, rank);
            if (value != null) {
                classification.put(rank, value);
            }
        }
        return classification;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
