package com.ednataxa.api.model;

import java.util.Collection;
import java.util.Set;

public record SkipPolicy(Set<String> assays) {

    public SkipPolicy {
        assays = assays == null ? Set.of() : Set.copyOf(assays);
    }

    public static SkipPolicy of(Collection<String> assayNames) {
        return new SkipPolicy(assayNames == null ? Set.of() : Set.copyOf(assayNames));
    }

    public boolean suppressesSpecies(String assayName) {
        return assayName != null && assays.contains(assayName);
    }
}
