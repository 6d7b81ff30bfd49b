package com.devflow.core.monitoring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Periodically re-reads git state of every monitored project.
 */
@Component
@ConditionalOnProperty(prefix = "devflow.monitoring", name = "git-polling", havingValue = "true", matchIfMissing = true)
public class GitStatePoller {

    private final MonitorManager monitorManager;

    public GitStatePoller(MonitorManager monitorManager) {
        this.monitorManager = monitorManager;
    }

    @Scheduled(initialDelayString = "${devflow.monitoring.git-poll-seconds:30}",
            fixedDelayString = "${devflow.monitoring.git-poll-seconds:30}",
            timeUnit = TimeUnit.SECONDS)
    public void poll() {
        monitorManager.refreshAll();
    }
}
