package com.paxkun.ezstremio.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.paxkun.ezstremio.service.metadata.StreamId;
import com.paxkun.ezstremio.service.metadata.TmdbDetail;
import com.paxkun.ezstremio.service.search.TitleContext;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Optional;

/**
 * MetadataService looks a title up on TMDB and turns it into the {@link TitleContext}
 * the stream search works from. Czech titles are requested since the catalog site is
 * Czech/Slovak; the original title is kept as the second search name.
 */
@Service
@RequiredArgsConstructor
public class MetadataService {

    private final WebClient webClient = WebClient.builder().build();
    private final Gson gson = new Gson();
    private final LoggerService logger;

    @Value("${tmdb.url:https://api.themoviedb.org/3}")
    private String tmdbUrl = "https://api.themoviedb.org/3";

    @Value("${tmdb.apiKey:${TMDB_API_KEY:}}")
    private String tmdbApiKey;

    @Value("${tmdb.language:cs-CZ}")
    private String language = "cs-CZ";

    @Value("${tmdb.timeoutSeconds:10}")
    private long timeoutSeconds = 10;

    /**
     * @param type Stremio type, "movie" or "series"
     * @param id   parsed content id; season and episode are carried over
     * @return the title to search for, or empty when TMDB could not be asked or had no answer
     */
    public Optional<TitleContext> resolveTitle(String type, StreamId id) {
        boolean series = "series".equals(type);
        TmdbDetail detail;
        try {
            detail = fetchDetail(series ? "tv" : "movie", id.tmdbId());
        } catch (RuntimeException e) {
            logger.error("METADATA", "❌ TMDB lookup failed for " + type + "/" + id.tmdbId() + ": " + e.getMessage(), e);
            return Optional.empty();
        }
        if (detail == null) {
            logger.warn("METADATA", "⚠️ TMDB returned no detail for " + type + "/" + id.tmdbId());
            return Optional.empty();
        }

        String name = series ? detail.getName() : detail.getTitle();
        String originalName = series ? detail.getOriginalName() : detail.getOriginalTitle();
        String year = yearOf(series ? detail.getFirstAirDate() : detail.getReleaseDate());

        TitleContext context = new TitleContext(name, originalName, year, id.season(), id.episode());
        logger.debug("METADATA", "Resolved " + type + "/" + id.tmdbId() + " to name=" + context.name()
                + " | original=" + context.originalName() + " | year=" + context.year());
        return Optional.of(context);
    }

    /**
     * @throws IllegalStateException if no TMDB API key is configured
     * @throws RuntimeException      if the request fails or the body is not valid JSON
     */
    private TmdbDetail fetchDetail(String tmdbType, String tmdbId) {
        if (tmdbApiKey == null || tmdbApiKey.isBlank()) {
            throw new IllegalStateException("TMDB_API_KEY is not configured. Set the TMDB_API_KEY environment variable or the 'tmdb.apiKey' property.");
        }

        String body;
        try {
            body = webClient.get()
                    .uri(tmdbUrl + "/{type}/{id}?api_key={key}&language={language}", tmdbType, tmdbId, tmdbApiKey, language)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(timeoutSeconds));
        } catch (WebClientResponseException e) {
            // the message would carry the request URI and with it the api key
            throw new RuntimeException("TMDB returned status: " + e.getStatusCode(), e);
        } catch (Exception e) {
            throw new RuntimeException("TMDB request failed: " + e.getClass().getSimpleName(), e);
        }

        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return gson.fromJson(body, TmdbDetail.class);
        } catch (JsonParseException e) {
            throw new RuntimeException("TMDB response was not valid JSON: " + e.getMessage(), e);
        }
    }

    private String yearOf(String date) {
        return date != null && date.length() >= 4 ? date.substring(0, 4) : "";
    }
}
