package com.paxkun.ezstremio.service.addon;

import com.paxkun.ezstremio.service.stream.RankedResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the {@code streams} array returned to Stremio.
 * Stremio shows {@code name} as the header and {@code title} as the multi-line body.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StremioStream {

    private String name;
    private String title;
    private String url;

    public static StremioStream from(RankedResult result) {
        return new StremioStream(result.name(), result.description(), result.url());
    }
}
