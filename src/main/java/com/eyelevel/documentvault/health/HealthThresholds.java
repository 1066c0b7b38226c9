package com.eyelevel.documentvault.health;

/**
 * Limits that move the worker health from healthy to degraded or unhealthy.
 *
 * @param maxQueueDepthAlert       waiting jobs above which the worker is degraded.
 * @param failedDegradedThreshold  dead jobs above which the worker is degraded.
 * @param failedUnhealthyThreshold dead jobs above which the worker is unhealthy.
 * @param backlogThreshold         waiting jobs above which a saturated worker is degraded.
 */
public record HealthThresholds(int maxQueueDepthAlert, long failedDegradedThreshold, long failedUnhealthyThreshold,
                               int backlogThreshold) {
}
