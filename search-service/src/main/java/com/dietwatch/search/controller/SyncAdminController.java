package com.dietwatch.search.controller;

import com.dietwatch.search.model.SyncJob;
import com.dietwatch.search.model.SyncQueueStats;
import com.dietwatch.search.sync.SyncQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin/sync")
public class SyncAdminController {

    private final SyncQueue syncQueue;

    public SyncAdminController(SyncQueue syncQueue) {
        this.syncQueue = syncQueue;
    }

    @GetMapping("/stats")
    public SyncQueueStats stats() {
        return syncQueue.stats();
    }

    @GetMapping("/dead-letters")
    public List<SyncJob> deadLetters(@RequestParam(value = "limit", required = false) Integer limit) {
        int resolvedLimit = (limit == null || limit <= 0) ? 50 : Math.min(limit, 500);
        return syncQueue.deadLetters(resolvedLimit);
    }

    @PostMapping("/dead-letters/{id}/requeue")
    public ResponseEntity<?> requeue(@PathVariable("id") long id) {
        if (!syncQueue.requeue(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, "no dead-lettered job with id " + id));
        }
        return ResponseEntity.ok(Map.of("id", id, "status", "PENDING"));
    }
}
