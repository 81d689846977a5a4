package com.paxkun.ezstremio.service.search;

import java.util.List;

/**
 * Runs one query against the upstream site search.
 */
public interface SearchClient {

    /**
     * @param query literal search text
     * @return hits found for the query, with absolute addresses; empty when nothing matched
     * @throws SourceFetchException when the search page could not be loaded
     */
    List<Candidate> search(String query);
}
