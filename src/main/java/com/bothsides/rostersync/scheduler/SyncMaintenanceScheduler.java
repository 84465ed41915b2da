package com.bothsides.rostersync.scheduler;

import com.bothsides.rostersync.queue.SyncJobQueue;
import com.bothsides.rostersync.service.RateLimiterService;
import com.bothsides.rostersync.service.SyncStatsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for sync engine housekeeping
 */
@Component
public class SyncMaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SyncMaintenanceScheduler.class);

    private final SyncJobQueue queue;
    private final RateLimiterService rateLimiter;
    private final SyncStatsService statsService;

    @Value("${sync-engine.maintenance.enabled:true}")
    private boolean maintenanceEnabled = true;

    @Autowired
    public SyncMaintenanceScheduler(SyncJobQueue queue,
                                    RateLimiterService rateLimiter,
                                    SyncStatsService statsService) {
        this.queue = queue;
        this.rateLimiter = rateLimiter;
        this.statsService = statsService;
    }

    /**
     * Reports running jobs that stopped sending heartbeats.
     * Runs every 30 seconds
     */
    @Scheduled(fixedDelayString = "${sync-engine.maintenance.stalled-check-interval-ms:30000}")
    public void inspectStalledJobs() {
        if (!maintenanceEnabled) {
            return;
        }
        int stalled = queue.inspectStalledJobs();
        if (stalled > 0) {
            logger.warn("Detected {} stalled sync jobs", stalled);
        }
    }

    /**
     * Drops rate limit trackers idle for more than an hour.
     * Runs every 10 minutes
     */
    @Scheduled(fixedDelay = 600000) // 10 minutes
    public void runMaintenanceTasks() {
        if (!maintenanceEnabled) {
            logger.debug("Sync engine maintenance is disabled");
            return;
        }
        int evicted = rateLimiter.evictIdleTrackers();
        logger.debug("Maintenance completed: {} idle rate limit trackers evicted", evicted);
    }

    /**
     * Logs a one-line engine summary.
     * Runs every 15 minutes
     */
    @Scheduled(fixedDelay = 900000) // 15 minutes
    public void runHealthCheck() {
        if (!maintenanceEnabled) {
            return;
        }
        statsService.getSyncEngineStats()
                .subscribe(
                        stats -> logger.info("Sync engine health: {} active, {} waiting, {} delayed, {} running, success rate {}%",
                                stats.activeJobs(), stats.waitingJobs(), stats.delayedJobs(), stats.runningJobs(),
                                String.format("%.1f", stats.successRate())),
                        error -> logger.error("Error during sync engine health check: {}", error.getMessage())
                );
    }
}
