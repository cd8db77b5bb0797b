package com.fallacylens.domain.analysis.model;

import java.util.List;

/**
 * Corrected version of the input with the detected fallacies addressed.
 *
 * @param text    the rewritten text
 * @param changes itemized edits, in the order the service reported them
 */
public record BalancedRewrite(
        String text,
        List<RewriteChange> changes
) {
    public BalancedRewrite {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
