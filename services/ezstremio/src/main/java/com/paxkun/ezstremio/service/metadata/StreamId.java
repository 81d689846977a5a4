package com.paxkun.ezstremio.service.metadata;

import java.util.Optional;

/**
 * Parsed Stremio content id: {@code eztmdb:<tmdbId>} for movies,
 * {@code eztmdb:<tmdbId>:<season>:<episode>} for series episodes.
 */
public record StreamId(String tmdbId, Integer season, Integer episode) {

    public static final String PREFIX = "eztmdb:";

    /**
     * @return the parsed id, or empty when the id is not one of ours
     */
    public static Optional<StreamId> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String id = raw.endsWith(".json") ? raw.substring(0, raw.length() - ".json".length()) : raw;
        if (!id.startsWith(PREFIX)) {
            return Optional.empty();
        }

        String[] parts = id.split(":");
        if (parts.length < 2 || parts[1].isBlank()) {
            return Optional.empty();
        }

        Integer season = null;
        Integer episode = null;
        if (parts.length >= 4) {
            season = parsePositive(parts[2]);
            episode = parsePositive(parts[3]);
        }
        return Optional.of(new StreamId(parts[1], season, episode));
    }

    private static Integer parsePositive(String value) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
