package com.paxkun.ezstremio.service.search;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds titles into a search-friendly form: diacritics stripped, separators turned into spaces.
 */
public final class TitleNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[._:-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleNormalizer() {
    }

    /**
     * "Dobrá čarodějka: Část 1" becomes "Dobra carodejka Cast 1".
     */
    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
        String spaced = SEPARATORS.matcher(folded).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /** Lowercased {@link #normalize(String)}, used for containment checks. */
    public static String normalizeForMatch(String value) {
        return normalize(value).toLowerCase(Locale.ROOT);
    }
}
