package com.paxkun.ezstremio.service.stream;

import com.paxkun.ezstremio.service.search.SourceFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * PrehrajDetailsClient fetches a video page over plain HTTP and hands the body to the
 * {@link StreamExtractor}. Each call opens its own connection, so it is safe to run
 * several at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrehrajDetailsClient implements DetailsClient {

    private final StreamExtractor extractor;

    @Value("${prehraj.details.userAgent:Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36}")
    private String userAgent = "Mozilla/5.0";

    @Value("${prehraj.details.timeoutMillis:10000}")
    private int timeoutMillis = 10000;

    @Override
    public List<StreamDescriptor> fetchDetails(String address) {
        String body;
        try {
            Connection.Response response = Jsoup.connect(address)
                    .userAgent(userAgent)
                    .timeout(timeoutMillis)
                    .maxBodySize(0)
                    .execute();
            body = response.body();
        } catch (IOException e) {
            throw new SourceFetchException("Details page failed: " + address + " | " + e.getMessage(), e);
        }

        List<StreamDescriptor> streams = extractor.extract(body);
        if (streams.isEmpty()) {
            throw new SourceFetchException("No sources found in script: " + address);
        }
        log.debug("🎞️ {} streams on {}", streams.size(), address);
        return streams;
    }
}
