package com.focusflow.backend.global.scheduling;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.focusflow.backend.global.config.FocusFlowProperties;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts every {@link ScheduledJob} once the application is ready and stops them on shutdown.
 */
@Component
public class ScheduledJobRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduledJobRegistry.class);

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private final boolean autoStart;

    public ScheduledJobRegistry(List<ScheduledJob> jobs, FocusFlowProperties properties) {
        jobs.forEach(job -> this.jobs.put(job.name(), job));
        this.autoStart = properties.jobs().enabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startAll() {
        if (!autoStart) {
            log.info("Background jobs disabled; {} registered but not started", jobs.keySet());
            return;
        }
        jobs.values().forEach(job -> {
            try {
                job.start();
            } catch (RuntimeException ex) {
                log.error("Failed to start {}", job.name(), ex);
            }
        });
    }

    @PreDestroy
    public void stopAll() {
        jobs.values().forEach(ScheduledJob::stop);
    }

    public List<ScheduledJob> list() {
        return List.copyOf(jobs.values());
    }

    public Optional<ScheduledJob> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }
}
