package com.apex.decisioncore.health;

public enum HealthSeverity {
    INFO,
    WARN,
    CRITICAL
}
