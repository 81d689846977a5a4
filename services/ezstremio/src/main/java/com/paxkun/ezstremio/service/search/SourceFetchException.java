package com.paxkun.ezstremio.service.search;

/**
 * Raised by a page-fetch collaborator when a search or details page could not be
 * retrieved, or when it held nothing usable.
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
