package com.apex.decisioncore.trading.trace;

import java.util.Map;

public record GateOutcome(boolean passed, String reason, Map<String, Object> details) {}
