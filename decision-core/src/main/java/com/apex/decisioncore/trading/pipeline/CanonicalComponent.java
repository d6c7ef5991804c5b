package com.apex.decisioncore.trading.pipeline;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The single alias table for signal component names. Every spelling the enrichment side is known to
 * send resolves here to one canonical name and its layer; anything else is treated as unmapped.
 */
public enum CanonicalComponent {
    OPTIONS_FLOW("options_flow", SignalLayer.FLOW, "flow", "uw_flow", "options_flow_score", "flow_strength", "uw_flow_strength"),
    WHALE_PERSISTENCE("whale_persistence", SignalLayer.FLOW, "whale", "whale_score"),
    ETF_FLOW("etf_flow", SignalLayer.FLOW, "etf"),
    MARKET_TIDE("market_tide", SignalLayer.FLOW, "tide"),
    OI_CHANGE("oi_change", SignalLayer.FLOW, "open_interest_change"),
    DARK_POOL("dark_pool", SignalLayer.DARK_POOL, "dp", "darkpool", "dark_pool_bias", "dp_bias"),
    REGIME_MODIFIER("regime_modifier", SignalLayer.REGIME, "regime", "macro", "market_regime"),
    EVENT_ALIGNMENT("event_alignment", SignalLayer.REGIME, "event"),
    CALENDAR_CATALYST("calendar_catalyst", SignalLayer.REGIME, "calendar", "catalyst"),
    IV_TERM_SKEW("iv_term_skew", SignalLayer.VOLATILITY, "term_skew"),
    SMILE_SLOPE("smile_slope", SignalLayer.VOLATILITY, "smile"),
    IV_RANK("iv_rank", SignalLayer.VOLATILITY, "ivr"),
    GREEKS_GAMMA("greeks_gamma", SignalLayer.VOLATILITY, "gamma", "gex"),
    INSIDER("insider", SignalLayer.OTHER),
    CONGRESS("congress", SignalLayer.OTHER),
    INSTITUTIONAL("institutional", SignalLayer.OTHER, "13f"),
    SHORTS_SQUEEZE("shorts_squeeze", SignalLayer.OTHER, "short_interest"),
    SQUEEZE_SCORE("squeeze_score", SignalLayer.OTHER, "squeeze"),
    FTD_PRESSURE("ftd_pressure", SignalLayer.OTHER, "ftd"),
    TEMPORAL_MOTIF("temporal_motif", SignalLayer.OTHER, "motif"),
    TOXICITY_PENALTY("toxicity_penalty", SignalLayer.OTHER, "toxicity");

    private static final Map<String, CanonicalComponent> BY_ALIAS = new HashMap<>();

    static {
        for (CanonicalComponent component : values()) {
            BY_ALIAS.put(component.canonicalName, component);
            for (String alias : component.aliases) {
                BY_ALIAS.put(alias, component);
            }
        }
    }

    private final String canonicalName;
    private final SignalLayer layer;
    private final List<String> aliases;

    CanonicalComponent(String canonicalName, SignalLayer layer, String... aliases) {
        this.canonicalName = canonicalName;
        this.layer = layer;
        this.aliases = List.of(aliases);
    }

    public String canonicalName() {
        return canonicalName;
    }

    public SignalLayer layer() {
        return layer;
    }

    public static String normalize(String rawName) {
        if (rawName == null) {
            return "";
        }
        return rawName.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }

    public static Optional<CanonicalComponent> resolve(String rawName) {
        return Optional.ofNullable(BY_ALIAS.get(normalize(rawName)));
    }

    /**
     * Layer for a name absent from the table, by substring match on the normalised name.
     */
    public static SignalLayer guessLayer(String rawName) {
        String n = normalize(rawName);
        if (n.contains("flow") || n.contains("whale") || n.contains("premium")) {
            return SignalLayer.FLOW;
        }
        if (n.contains("dark") || n.startsWith("dp_") || n.contains("_dp")) {
            return SignalLayer.DARK_POOL;
        }
        if (n.contains("regime") || n.contains("macro")) {
            return SignalLayer.REGIME;
        }
        if (n.contains("vol") || n.contains("atr") || n.startsWith("iv") || n.contains("_iv")) {
            return SignalLayer.VOLATILITY;
        }
        return SignalLayer.OTHER;
    }
}
