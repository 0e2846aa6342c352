package com.structura.labeling.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Entry state of the labeling orchestrator.
 */
public enum LabelingMode {
    /** Deterministic labels only; the remote classifier is never called. */
    RULE("rule"),
    /** One remote review covering every paragraph, rule labels as safety net. */
    REMOTE("remote"),
    /** Remote review only for paragraphs flagged by the trigger conditions. */
    HYBRID("hybrid");

    private final String wireName;

    LabelingMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a configured mode name. Accepts the wire names plus the aliases
     * {@code llm}, {@code remote-only} and {@code rule-only}, ignoring case and surrounding blanks.
     *
     * @param value configured name (may be null)
     * @return parsed mode, or empty if the name is not recognized
     */
    public static Optional<LabelingMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "rule", "rule-only", "rule_only" -> Optional.of(RULE);
            case "remote", "remote-only", "remote_only", "llm" -> Optional.of(REMOTE);
            case "hybrid" -> Optional.of(HYBRID);
            default -> Optional.empty();
        };
    }
}
