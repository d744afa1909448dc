package com.example.trackscheduler.application.job;

import com.example.trackscheduler.application.service.TrackSchedulerService;
import com.example.trackscheduler.common.config.AppSchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

/**
 * Re-activates the scope and current track saved by the previous run.
 */
@Service
public class ScopeRestoreJob implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScopeRestoreJob.class);

    private final AppSchedulerProperties properties;
    private final TrackSchedulerService scheduler;

    public ScopeRestoreJob(AppSchedulerProperties properties, TrackSchedulerService scheduler) {
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRestoreOnStartup()) {
            log.info("Scope restore skipped: disabled by app.scheduler.restore-on-startup");
            return;
        }
        try {
            scheduler.restore();
        } catch (RuntimeException e) {
            // Startup continues on the queue scope.
            log.warn("Scope restore failed, dataDir={}", properties.getDataDir(), e);
        }
    }
}
