package com.darksite.metering.scheduler;

import com.darksite.metering.config.MeteringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Registers the two periodic tasks on a shared task scheduler.
 *
 * TASKS:
 * 1. {@code collection} - fixed rate, every {@code metering.collection.interval}
 * 2. {@code daily-export} - cron at {@code metering.export.time} in the service's zone
 *
 * The scheduler has more than one thread, so a long export never holds up a
 * collection tick. {@link #triggerNow(String)} runs a task once, out of schedule.
 */
@Component
@Slf4j
public class MeteringScheduler implements SchedulingConfigurer {

    public static final String COLLECTION = "collection";
    public static final String DAILY_EXPORT = "daily-export";

    private final TaskScheduler taskScheduler;
    private final Map<String, Runnable> tasks;
    private final Clock clock;
    private final Duration interval;
    private final LocalTime exportTime;
    private final boolean exportOnStartup;

    public MeteringScheduler(TaskScheduler taskScheduler, CollectionJob collectionJob, DailyExportJob dailyExportJob,
                             Clock clock, MeteringProperties properties) {
        this.taskScheduler = taskScheduler;
        this.tasks = Map.of(COLLECTION, collectionJob, DAILY_EXPORT, dailyExportJob);
        this.clock = clock;
        this.interval = properties.getCollection().getInterval();
        this.exportTime = properties.getExport().timeOfDay();
        this.exportOnStartup = properties.getExport().isRunOnStartup();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(taskScheduler);
        registrar.addFixedRateTask(tasks.get(COLLECTION), interval);
        registrar.addTriggerTask(tasks.get(DAILY_EXPORT), exportTrigger());
        log.info("Scheduled {} every {}s and {} daily at {} ({})",
                COLLECTION, interval.toSeconds(), DAILY_EXPORT, exportTime, clock.getZone());
    }

    /**
     * Run a task once as soon as a scheduler thread is free.
     *
     * @throws IllegalArgumentException for an unknown task name
     */
    public ScheduledFuture<?> triggerNow(String taskName) {
        Runnable task = tasks.get(taskName);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskName);
        }
        log.info("Triggering {} now", taskName);
        return taskScheduler.schedule(task, clock.instant());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (exportOnStartup) {
            log.info("Export on startup requested");
            triggerNow(DAILY_EXPORT);
        }
    }

    String exportCron() {
        return "0 " + exportTime.getMinute() + " " + exportTime.getHour() + " * * *";
    }

    CronTrigger exportTrigger() {
        return new CronTrigger(exportCron(), clock.getZone());
    }
}
