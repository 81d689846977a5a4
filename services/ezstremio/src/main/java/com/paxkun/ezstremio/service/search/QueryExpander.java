package com.paxkun.ezstremio.service.search;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * QueryExpander turns one {@link TitleContext} into the ordered list of search strings
 * sent to prehraj.to. The site search is literal, so each name is tried raw, without
 * diacritics and with colons split, each of those with and without the release year.
 * <p>
 * The output never contains an empty or duplicate query and is the same for the
 * same context on every call.
 */
@Component
public class QueryExpander {

    public List<String> expand(TitleContext context) {
        if (context.name().isBlank()) {
            return List.of();
        }

        List<String> variants = new ArrayList<>();
        for (String name : context.searchNames()) {
            addVariations(name, variants);
        }

        String suffix = context.hasEpisode()
                ? String.format(Locale.ROOT, " S%02dE%02d", context.season(), context.episode())
                : "";

        Set<String> queries = new LinkedHashSet<>();
        for (String variant : variants) {
            addQuery(queries, variant + suffix);
            if (!context.year().isEmpty()) {
                addQuery(queries, variant + " " + context.year() + suffix);
            }
        }
        return List.copyOf(queries);
    }

    private void addVariations(String name, List<String> variants) {
        List<String> own = new ArrayList<>();
        own.add(name);

        String normalized = TitleNormalizer.normalize(name);
        if (!normalized.equals(name)) {
            own.add(normalized);
        }

        if (name.contains(":")) {
            String colonSplit = name.replace(":", " ");
            if (!own.contains(colonSplit)) {
                own.add(colonSplit);
            }
        }
        variants.addAll(own);
    }

    private void addQuery(Set<String> queries, String query) {
        String trimmed = query.trim();
        if (!trimmed.isEmpty()) {
            queries.add(trimmed);
        }
    }
}
