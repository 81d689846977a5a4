package com.paxkun.ezstremio.service.search;

/**
 * One raw hit from the prehraj.to search page.
 * The address is always absolute; relative links are resolved by the search client.
 */
public record Candidate(String title, String duration, String size, String address) {

    public Candidate {
        title = title == null ? "" : title;
        duration = duration == null ? "" : duration;
        size = size == null ? "" : size;
    }
}
