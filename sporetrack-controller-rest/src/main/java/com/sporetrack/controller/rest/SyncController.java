package com.sporetrack.controller.rest;

import com.sporetrack.service.core.sync.ResyncService;
import com.sporetrack.service.core.sync.ResyncService.ResyncReport;
import com.sporetrack.service.core.sync.SyncStatus;
import java.time.Instant;
import org.springframework.web.bind.annotation.*;

/** Operator endpoints; resync covers the whole store and is not tenant scoped. */
@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final ResyncService resync;

    public SyncController(ResyncService resync) {
        this.resync = resync;
    }

    @PostMapping("/resync")
    public ResyncReport resync(
            @RequestParam(defaultValue = "false") boolean fromScratch,
            @RequestParam(required = false) Instant from) {
        return from != null ? resync.resyncFrom(from) : resync.resync(fromScratch);
    }

    @GetMapping("/status")
    public SyncStatus status() {
        return resync.status();
    }
}
