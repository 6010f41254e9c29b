package com.vidnyan.kpolicy.domain.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;

/**
 * Structural predicate bound to a check definition.
 * Implementations must be pure and safe to call from several threads.
 */
@FunctionalInterface
public interface CheckPredicate {

    /**
     * Test a manifest fragment.
     *
     * @param fragment the fragment shaped according to the definition's schema target
     * @return true if the fragment satisfies the check
     * @throws MalformedCheckException if the predicate cannot be evaluated against the fragment
     */
    boolean test(JsonNode fragment);
}
