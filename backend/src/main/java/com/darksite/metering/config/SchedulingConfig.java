package com.darksite.metering.config;

import com.darksite.metering.billing.BillingExportFile;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Task scheduler and export file beans for the periodic jobs.
 */
@Configuration
public class SchedulingConfig {

    /**
     * Collection and export each get a thread, plus one for out-of-schedule triggers.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(MeteringProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("metering-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds((int) properties.getCollection().getCycleBudget().toSeconds() + 5);
        return scheduler;
    }

    @Bean
    public BillingExportFile billingExportFile(MeteringProperties properties, Clock clock) {
        MeteringProperties.Export export = properties.getExport();
        return new BillingExportFile(export.getDirectory(), export.getExtension(), clock.getZone());
    }
}
