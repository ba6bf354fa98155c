package com.trellis.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * SSE streams of coordination events.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final SseStreamingService sseStreamingService;

    public EventController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /api/v1/events: Every event on the bus.
     */
    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamAll() {
        return ResponseEntity.ok(sseStreamingService.createGlobalEmitter());
    }

    /**
     * GET /api/v1/events/{scopeId}: Events of one task or thread.
     */
    @GetMapping(value = "/{scopeId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamScope(@PathVariable String scopeId) {
        return ResponseEntity.ok(sseStreamingService.createEmitter(scopeId));
    }
}
