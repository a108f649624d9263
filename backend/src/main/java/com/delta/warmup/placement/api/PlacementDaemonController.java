package com.delta.warmup.placement.api;

import com.delta.warmup.placement.model.SchedulerCycleSummary;
import com.delta.warmup.placement.model.SchedulerDaemonStatusResponse;
import com.delta.warmup.placement.service.PlacementSchedulerDaemonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/daemon")
public class PlacementDaemonController {
    private final PlacementSchedulerDaemonService daemonService;

    public PlacementDaemonController(PlacementSchedulerDaemonService daemonService) {
        this.daemonService = daemonService;
    }

    @PostMapping("/start")
    public SchedulerDaemonStatusResponse start() {
        daemonService.start();
        return daemonService.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerDaemonStatusResponse stop() {
        daemonService.stop();
        return daemonService.getStatus();
    }

    @GetMapping("/status")
    public SchedulerDaemonStatusResponse status() {
        return daemonService.getStatus();
    }

    @PostMapping("/cycle")
    public SchedulerCycleSummary runCycle() {
        return daemonService.runCycle();
    }
}
