package com.movi.agent.api;

import com.movi.agent.observability.TraceService;
import com.movi.agent.observability.TurnTrace;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/traces/thread/{threadId}  turn traces for a thread, newest first
 * GET /api/v1/traces/analytics          avg latency, tokens last 24h, status breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/thread/{threadId}")
    public ResponseEntity<List<TurnTrace>> getThreadTraces(@PathVariable String threadId) {
        return ResponseEntity.ok(traceService.getTracesForThread(threadId));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
