package com.apex.decisioncore.health;

public record CheckOutcome(boolean healthy, String message) {

    public static CheckOutcome healthy(String message) {
        return new CheckOutcome(true, message);
    }

    public static CheckOutcome unhealthy(String message) {
        return new CheckOutcome(false, message);
    }
}
