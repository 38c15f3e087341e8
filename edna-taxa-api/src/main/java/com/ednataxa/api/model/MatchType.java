package com.ednataxa.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    EXACT("exact"),
    FUZZY("fuzzy"),
    ACCEPTED_SYNONYM("accepted-synonym"),
    NO_MATCH("no-match");

    private final String label;

    MatchType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
