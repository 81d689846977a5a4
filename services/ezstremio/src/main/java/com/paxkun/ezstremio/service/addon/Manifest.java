package com.paxkun.ezstremio.service.addon;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Stremio add-on manifest served at {@code /manifest.json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Manifest {

    private String id;
    private String version;
    private String name;
    private String description;
    private List<String> resources;
    private List<String> types;

    /** Always empty; this add-on only answers stream requests. */
    private List<Object> catalogs;

    private List<String> idPrefixes;

    public static Manifest defaultManifest(String version) {
        return new Manifest(
                "org.ezstremio.addon",
                version,
                "ezStremio",
                "Czech/Slovak dubbed films and TV shows",
                List.of("stream"),
                List.of("movie", "series"),
                List.of(),
                List.of("eztmdb:"));
    }
}
