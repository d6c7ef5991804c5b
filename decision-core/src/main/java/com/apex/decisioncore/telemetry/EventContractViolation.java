package com.apex.decisioncore.telemetry;

import com.apex.decisioncore.exception.TradingException;

import java.util.List;

public class EventContractViolation extends TradingException {
    private final EventType eventType;
    private final List<String> missingFields;

    public EventContractViolation(EventType eventType, List<String> missingFields) {
        super(eventType + " record missing required fields " + missingFields);
        this.eventType = eventType;
        this.missingFields = List.copyOf(missingFields);
    }

    public EventType getEventType() {
        return eventType;
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
