package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of a single design check.
 */
public enum CheckStatus {
    PASS("pass"),
    FAIL("fail");

    private final String id;

    CheckStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static CheckStatus of(boolean passed) {
        return passed ? PASS : FAIL;
    }
}
