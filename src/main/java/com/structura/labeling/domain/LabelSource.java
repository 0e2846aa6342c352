package com.structura.labeling.domain;

/**
 * Origin of a final paragraph label.
 */
public enum LabelSource {
    RULE("rule"),
    REMOTE("remote");

    private final String wireName;

    LabelSource(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
