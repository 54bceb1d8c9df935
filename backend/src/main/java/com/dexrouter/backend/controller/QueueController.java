package com.dexrouter.backend.controller;

import com.dexrouter.backend.service.queue.JobState;
import com.dexrouter.backend.service.queue.OrderJob;
import com.dexrouter.backend.service.queue.OrderQueueService;
import com.dexrouter.backend.service.queue.QueueMetrics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
@Tag(name = "Queue")
public class QueueController {

    private final OrderQueueService orderQueueService;

    @GetMapping("/metrics")
    @Operation(summary = "Queued, delayed, in-flight, completed and failed job counts")
    public QueueMetrics metrics() {
        return orderQueueService.metrics();
    }

    @GetMapping("/jobs")
    @Operation(summary = "Recently finished jobs")
    public List<OrderJob> recentJobs(@RequestParam(defaultValue = "COMPLETED") JobState state) {
        return orderQueueService.recentJobs(state);
    }
}
