package com.ednataxa.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchSource {
    LOCAL("local"),
    WORMS("worms"),
    GBIF("gbif");

    private final String label;

    MatchSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
