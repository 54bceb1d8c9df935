package com.dexrouter.backend.controller;

import com.dexrouter.backend.dto.HealthResponse;
import com.dexrouter.backend.service.queue.OrderQueueService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final OrderQueueService orderQueueService;

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", Instant.now(), orderQueueService.metrics());
    }
}
