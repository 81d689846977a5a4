package com.paxkun.ezstremio.service.search;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of the media a stream request is about.
 * Built once per request from the metadata lookup and read-only afterwards.
 *
 * @param name         localized title, the primary search term
 * @param originalName original-language title, may be empty or equal to {@code name}
 * @param year         release year, empty when unknown
 * @param season       season number for series, {@code null} for movies
 * @param episode      episode number for series, {@code null} for movies
 */
public record TitleContext(String name, String originalName, String year, Integer season, Integer episode) {

    public TitleContext {
        name = name == null ? "" : name;
        originalName = originalName == null ? "" : originalName;
        year = year == null ? "" : year.trim();
    }

    public static TitleContext movie(String name, String originalName, String year) {
        return new TitleContext(name, originalName, year, null, null);
    }

    public boolean hasEpisode() {
        return season != null && episode != null;
    }

    /**
     * The distinct names worth searching for: {@code name}, plus {@code originalName}
     * when it is present and differs.
     */
    public List<String> searchNames() {
        List<String> names = new ArrayList<>();
        names.add(name);
        if (!originalName.isEmpty() && !originalName.equals(name)) {
            names.add(originalName);
        }
        return names;
    }
}
