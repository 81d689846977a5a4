package com.paxkun.ezstremio.service.stream;

import java.util.List;

/**
 * Opens a search hit's page and lists the streams it offers.
 */
public interface DetailsClient {

    /**
     * @param address absolute URL of the details page
     * @return at least one stream, without origin fields
     * @throws com.paxkun.ezstremio.service.search.SourceFetchException when the page could not be
     *         fetched or contained no sources
     */
    List<StreamDescriptor> fetchDetails(String address);
}
