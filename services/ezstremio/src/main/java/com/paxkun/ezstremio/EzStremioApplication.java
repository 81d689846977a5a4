package com.paxkun.ezstremio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ezStremio Application Entry Point
 *
 * Stremio add-on that finds Czech/Slovak streams on prehraj.to for TMDB titles.
 */
@SpringBootApplication
public class EzStremioApplication {
    public static void main(String[] args) {
        SpringApplication.run(EzStremioApplication.class, args);
    }
}
