package com.eyelevel.documentvault.health;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
