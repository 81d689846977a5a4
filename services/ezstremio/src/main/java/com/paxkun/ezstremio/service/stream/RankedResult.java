package com.paxkun.ezstremio.service.stream;

/**
 * A stream as presented to the player: header line, multi-line description, playable URL.
 */
public record RankedResult(String name, String description, String url) {
}
