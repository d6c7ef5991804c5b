package com.apex.decisioncore.trading.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One enriched input as delivered by the enrichment side. {@code value} is deliberately untyped: it may
 * be a number, a numeric string or a nested map and is coerced during aggregation.
 *
 * @param sourceLayer optional layer hint, only consulted for names missing from the alias table
 */
public record SignalComponent(String name, Object value, String sourceLayer) {

    public static SignalComponent of(String name, Object value) {
        return new SignalComponent(name, value, null);
    }

    public static List<SignalComponent> fromMap(Map<String, ?> values) {
        List<SignalComponent> components = new ArrayList<>();
        if (values == null) {
            return components;
        }
        values.forEach((name, value) -> components.add(of(name, value)));
        return components;
    }
}
