package com.ednataxa.api.util;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans raw taxon names as they come out of classifier lineages and reference sheets.
 */
public final class ScientificNames {

    private static final Set<String> PLACEHOLDERS = Set.of("unassigned", "nan", "none", "na", "null");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern OPEN_NOMENCLATURE = Pattern.compile("\\s+spp?\\.(?=\\s|$)");

    private ScientificNames() {}

    /**
     * @return the cleaned name, or null when nothing usable remains
     */
    public static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.replace('_', ' ').replace('-', ' ').replace('/', ' ').trim();
        if (name.isEmpty() || PLACEHOLDERS.contains(name.toLowerCase(Locale.ROOT))) {
            return null;
        }
        name = OPEN_NOMENCLATURE.matcher(name).replaceAll("");
        name = DIGITS.matcher(name).replaceAll("");
        name = WHITESPACE.matcher(name).replaceAll(" ").trim();
        return name.length() > 1 ? name : null;
    }

    /** Lookup key: cleaned, trimmed and lower-cased. */
    public static String normalize(String raw) {
        String cleaned = clean(raw);
        return cleaned == null ? null : cleaned.toLowerCase(Locale.ROOT);
    }
}
