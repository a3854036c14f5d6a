package com.example.equationreader.service.pipeline;

/**
 * Escalation levels of the canonicalizer, least destructive first.
 */
public enum Tier {
    PRIMARY("primary", true),
    HEURISTIC("heuristic", true),
    DEEP_CLEAN("deep-clean", false),
    RAW_FALLBACK("raw-fallback", false);

    private final String label;
    private final boolean structuredParser;

    Tier(String label, boolean structuredParser) {
        this.label = label;
        this.structuredParser = structuredParser;
    }

    public String label() {
        return label;
    }

    public boolean usesStructuredParser() {
        return structuredParser;
    }

    /**
     * The tier tried after this one fails, or {@code null} after the last tier.
     */
    public Tier next() {
        int ordinal = ordinal() + 1;
        return ordinal < values().length ? values()[ordinal] : null;
    }
}
