package com.edwardjones.personnelsync.controller;

import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.service.SyncJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual trigger for a sync outside the schedule.
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncJobService syncJobService;
    private final SyncProperties properties;

    /**
     * Run all sync sets now. {@code dryRun} overrides the configured mode for this run only.
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, ChangeResults>> run(@RequestParam(required = false) Boolean dryRun) {
        boolean effectiveDryRun = dryRun != null ? dryRun : properties.isDryRun();
        log.info("Manual sync requested (dry run: {})", effectiveDryRun);
        return ResponseEntity.ok(syncJobService.runAll(effectiveDryRun));
    }
}
