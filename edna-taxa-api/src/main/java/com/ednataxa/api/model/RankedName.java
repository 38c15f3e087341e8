package com.ednataxa.api.model;

import java.util.Locale;

public record RankedName(String rank, String name) {

    public static final String SPECIES = "species";

    public boolean isSpecies() {
        return SPECIES.equals(rank);
    }

    public String keyPart() {
        return rank + "=" + name.toLowerCase(Locale.ROOT);
    }
}
