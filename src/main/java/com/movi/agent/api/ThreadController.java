package com.movi.agent.api;

import com.movi.agent.audit.ThreadAuditService;
import com.movi.agent.audit.ThreadMetadata;
import com.movi.agent.checkpoint.CheckpointStore;
import com.movi.agent.model.SessionState;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only audit views.
 *
 * GET /api/threads                     most recently active threads
 * GET /api/threads/{threadId}          full checkpointed session state
 * GET /api/threads/{threadId}/metadata turn count, last page, last status
 */
@RestController
@RequestMapping("/api/threads")
@RequiredArgsConstructor
public class ThreadController {

    private final CheckpointStore checkpointStore;
    private final ThreadAuditService auditService;

    @GetMapping
    public ResponseEntity<List<ThreadMetadata>> recentThreads() {
        return ResponseEntity.ok(auditService.recentThreads());
    }

    @GetMapping("/{threadId}")
    public ResponseEntity<SessionState> getThread(@PathVariable String threadId) {
        return checkpointStore.load(threadId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{threadId}/metadata")
    public ResponseEntity<ThreadMetadata> getMetadata(@PathVariable String threadId) {
        return auditService.find(threadId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
