package com.cronium.app.health;

import com.cronium.engine.schedule.JobScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness endpoint with JVM and scheduler stats.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JobScheduler scheduler;

    public HealthEndpoint(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("total_mb", rt.totalMemory() / (1024 * 1024));
        memory.put("free_mb", rt.freeMemory() / (1024 * 1024));
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));

        var threads = node.putObject("threads");
        threads.put("active", Thread.activeCount());

        var jobs = node.putObject("scheduler");
        jobs.put("zone", scheduler.getZone().getId());
        jobs.put("scheduledEvents", scheduler.scheduledEventIds().size());

        return node;
    }
}
