package com.paxkun.ezstremio.controller;

import com.paxkun.ezstremio.service.LoggerService;
import com.paxkun.ezstremio.service.MetadataService;
import com.paxkun.ezstremio.service.StreamService;
import com.paxkun.ezstremio.service.addon.StremioStream;
import com.paxkun.ezstremio.service.metadata.StreamId;
import com.paxkun.ezstremio.service.search.TitleContext;
import com.paxkun.ezstremio.service.stream.RankedResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * StreamController answers Stremio's stream requests.
 * Unknown ids and failed lookups yield an empty {@code streams} array, never an error status.
 */
@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class StreamController {

    private final MetadataService metadataService;
    private final StreamService streamService;
    private final LoggerService logger;

    /**
     * @param type Stremio content type, "movie" or "series"
     * @param id   content id, e.g. {@code eztmdb:402431.json} or {@code eztmdb:1399:1:2.json}
     * @return {@code {"streams": [...]}}, best stream first
     */
    @GetMapping("/stream/{type}/{id}")
    public ResponseEntity<Map<String, List<StremioStream>>> streams(@PathVariable String type, @PathVariable String id) {
        logger.info("STREAM_CONTROLLER", "Handling stream request | type=" + sanitizeForLog(type) + " | id=" + sanitizeForLog(id));

        Optional<StreamId> streamId = StreamId.parse(id);
        if (streamId.isEmpty()) {
            logger.debug("STREAM_CONTROLLER", "Unsupported id, returning no streams | id=" + sanitizeForLog(id));
            return noStreams();
        }

        Optional<TitleContext> title = metadataService.resolveTitle(type, streamId.get());
        if (title.isEmpty()) {
            return noStreams();
        }

        List<StremioStream> streams = new ArrayList<>();
        for (RankedResult result : streamService.findStreams(title.get())) {
            streams.add(StremioStream.from(result));
        }
        return ResponseEntity.ok(Map.of("streams", streams));
    }

    private ResponseEntity<Map<String, List<StremioStream>>> noStreams() {
        return ResponseEntity.ok(Map.of("streams", List.of()));
    }

    private String sanitizeForLog(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^\\p{Alnum}\\s_:.-]", "").trim();
    }
}
