package com.prague.apartments.crawl.api;

import com.prague.apartments.crawl.model.SchedulerStatusResponse;
import com.prague.apartments.crawl.service.IngestionScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final IngestionScheduler scheduler;

    public SchedulerController(IngestionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return scheduler.getStatus();
    }
}
