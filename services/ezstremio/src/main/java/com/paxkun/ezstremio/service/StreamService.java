package com.paxkun.ezstremio.service;

import com.paxkun.ezstremio.service.search.BoundedExecutor;
import com.paxkun.ezstremio.service.search.Candidate;
import com.paxkun.ezstremio.service.search.QueryExpander;
import com.paxkun.ezstremio.service.search.RelevanceFilter;
import com.paxkun.ezstremio.service.search.SearchClient;
import com.paxkun.ezstremio.service.search.TitleContext;
import com.paxkun.ezstremio.service.stream.DetailsClient;
import com.paxkun.ezstremio.service.stream.RankedResult;
import com.paxkun.ezstremio.service.stream.StreamDescriptor;
import com.paxkun.ezstremio.service.stream.StreamRanker;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * StreamService answers "which streams exist for this title, best first".
 * <p>
 * Queries are expanded from the title, searched with the search concurrency, filtered and
 * deduplicated, the first {@code pipeline.extract.limit} hits are opened with the extract
 * concurrency, and the streams found are ranked. Failures of single searches or pages only
 * shrink the result; this service never throws to its caller.
 */
@Service
@RequiredArgsConstructor
public class StreamService implements InitializingBean {

    private final QueryExpander queryExpander;
    private final RelevanceFilter relevanceFilter;
    private final BoundedExecutor executor;
    private final SearchClient searchClient;
    private final DetailsClient detailsClient;
    private final StreamRanker ranker;
    private final LoggerService logger;

    @Value("${pipeline.search.concurrency:1}")
    private int searchConcurrency = 1;

    @Value("${pipeline.extract.concurrency:5}")
    private int extractConcurrency = 5;

    @Value("${pipeline.extract.limit:25}")
    private int extractLimit = 25;

    /** Concurrency and limit settings must be at least 1. */
    @Override
    public void afterPropertiesSet() {
        requirePositive("pipeline.search.concurrency", searchConcurrency);
        requirePositive("pipeline.extract.concurrency", extractConcurrency);
        requirePositive("pipeline.extract.limit", extractLimit);
        logger.info("STREAM_SERVICE", "⚙️ Pipeline configured | search=" + searchConcurrency
                + " | extract=" + extractConcurrency + " | limit=" + extractLimit);
    }

    private void requirePositive(String property, int value) {
        if (value < 1) {
            throw new IllegalStateException(property + " must be at least 1, got " + value);
        }
    }

    public List<RankedResult> findStreams(TitleContext context) {
        String title = sanitizeForLog(context.name());

        List<String> queries = queryExpander.expand(context);
        if (queries.isEmpty()) {
            logger.warn("STREAM_SERVICE", "⚠️ No usable search queries for title=" + title);
            return List.of();
        }
        logger.info("STREAM_SERVICE", "🔍 Searching prehraj.to with queries: [" + String.join(", ", queries) + "]");

        List<Candidate> found = executor.runAll("SEARCH", queries, searchConcurrency, searchClient::search);
        List<Candidate> relevant = relevanceFilter.filter(found, context);
        logger.info("STREAM_SERVICE", "📋 Found " + relevant.size() + " unique results | raw=" + found.size()
                + " | title=" + title);

        List<Candidate> selected = relevant.size() > extractLimit
                ? new ArrayList<>(relevant.subList(0, extractLimit))
                : relevant;

        List<StreamDescriptor> streams = executor.runAll("EXTRACT", selected, extractConcurrency, this::extractStreams);
        List<RankedResult> ranked = ranker.rank(streams, context.year());

        logger.info("STREAM_SERVICE", "✅ Returning " + ranked.size() + " streams for title=" + title);
        return ranked;
    }

    private List<StreamDescriptor> extractStreams(Candidate candidate) {
        List<StreamDescriptor> merged = new ArrayList<>();
        for (StreamDescriptor stream : detailsClient.fetchDetails(candidate.address())) {
            merged.add(stream.withOrigin(candidate));
        }
        return merged;
    }

    private String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").trim();
    }
}
