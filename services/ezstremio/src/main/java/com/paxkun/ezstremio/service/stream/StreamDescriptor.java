package com.paxkun.ezstremio.service.stream;

import com.paxkun.ezstremio.service.search.Candidate;

/**
 * One playable source found on a details page.
 *
 * @param label                the stream's own quality tag, e.g. "1080p", or "Unknown"
 * @param sourceResolutionHint resolution of the uploaded original as shown on the page, may be empty
 * @param address              playable URL
 * @param originTitle          title of the search hit the page belongs to
 * @param originSize           size text of that hit
 * @param originDuration       duration text of that hit
 */
public record StreamDescriptor(
        String label,
        String sourceResolutionHint,
        String address,
        String originTitle,
        String originSize,
        String originDuration) {

    public static final String UNKNOWN_LABEL = "Unknown";

    public StreamDescriptor {
        label = label == null || label.isEmpty() ? UNKNOWN_LABEL : label;
        sourceResolutionHint = sourceResolutionHint == null ? "" : sourceResolutionHint;
        originTitle = originTitle == null ? "" : originTitle;
        originSize = originSize == null ? "" : originSize;
        originDuration = originDuration == null ? "" : originDuration;
    }

    public StreamDescriptor(String label, String sourceResolutionHint, String address) {
        this(label, sourceResolutionHint, address, "", "", "");
    }

    /** Copy carrying the title, size and duration of the search hit it was found through. */
    public StreamDescriptor withOrigin(Candidate candidate) {
        return new StreamDescriptor(label, sourceResolutionHint, address,
                candidate.title(), candidate.size(), candidate.duration());
    }
}
