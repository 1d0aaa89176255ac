package com.cronium.app.config;

import com.cronium.engine.dispatch.DispatchCoordinator;
import com.cronium.engine.schedule.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Arms timers for every active scheduled event once the application is up.
 */
@Slf4j
@Component
public class SchedulerBootstrap {

    private final JobScheduler scheduler;
    private final DispatchCoordinator coordinator;

    public SchedulerBootstrap(JobScheduler scheduler, DispatchCoordinator coordinator) {
        this.scheduler = scheduler;
        this.coordinator = coordinator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Starting scheduler (zone {}, dispatcher {})", scheduler.getZone(),
                coordinator.getClass().getSimpleName());
        scheduler.initialize();
    }
}
