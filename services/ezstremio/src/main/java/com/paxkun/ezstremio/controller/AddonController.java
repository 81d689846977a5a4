package com.paxkun.ezstremio.controller;

import com.paxkun.ezstremio.service.addon.Manifest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Add-on discovery and health endpoints.
 */
@RestController
@CrossOrigin(origins = "*")
public class AddonController {

    @Value("${addon.version:0.1.1}")
    private String version = "0.1.1";

    // Used by Docker for health check
    @GetMapping("/api/health")
    public ResponseEntity<String> apiHealthCheck() {
        return ResponseEntity.ok("ezStremio is alive!");
    }

    @GetMapping("/manifest.json")
    public ResponseEntity<Manifest> manifest() {
        return ResponseEntity.ok(Manifest.defaultManifest(version));
    }
}
