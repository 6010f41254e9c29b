package com.vidnyan.kpolicy.domain.result;

import com.vidnyan.kpolicy.domain.check.Severity;

/**
 * Outcome of one check.
 * Immutable value object.
 */
public record ResultRecord(
    String id,
    Severity severity,
    String category,
    boolean success,
    String message
) {
}
