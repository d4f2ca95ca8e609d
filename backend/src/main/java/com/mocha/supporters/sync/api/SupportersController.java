package com.mocha.supporters.sync.api;

import com.mocha.supporters.sync.model.SupporterDataset;
import com.mocha.supporters.sync.service.SupporterSyncService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/supporters")
public class SupportersController {
    private final SupporterSyncService syncService;

    public SupportersController(SupporterSyncService syncService) {
        this.syncService = syncService;
    }

    @GetMapping
    public SupporterDataset latest() {
        return syncService.latest()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No supporter sync has completed yet"));
    }

    @PostMapping("/sync")
    public SupporterDataset sync(@RequestParam(name = "slug", required = false) String slug) {
        return syncService.sync(slug);
    }
}
