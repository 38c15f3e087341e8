package com.ednataxa.api.config;

public enum Provider {
    WORMS("WoRMS"),
    GBIF("GBIF");

    private final String displayName;

    Provider(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
