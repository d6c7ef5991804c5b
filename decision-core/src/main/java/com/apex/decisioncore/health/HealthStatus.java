package com.apex.decisioncore.health;

public enum HealthStatus {
    HEALTHY,
    UNHEALTHY,
    ERROR
}
