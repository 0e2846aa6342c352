package com.structura.labeling.domain;

/**
 * Canonical structural role names shared by the rule engine, the remote classifier and the
 * formatting engine.
 */
public final class ParagraphRoles {

    public static final String H1 = "h1";
    public static final String H2 = "h2";
    public static final String H3 = "h3";
    public static final String BODY = "body";
    public static final String CAPTION = "caption";
    public static final String UNKNOWN = "unknown";

    private ParagraphRoles() {
        // Constants holder
    }
}
