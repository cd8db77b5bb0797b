package com.fallacylens.domain.analysis.model;

/**
 * Why the rewrite is (or is not) present. Several of these surface as a null rewrite,
 * so this is what distinguishes "not needed" from "failed" in diagnostics.
 */
public enum RewriteStatus {
    SUCCEEDED,
    NOT_REQUESTED,
    NOT_NEEDED,
    FAILED,
    ABANDONED
}
