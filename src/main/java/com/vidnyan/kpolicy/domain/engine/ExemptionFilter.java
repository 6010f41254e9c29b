package com.vidnyan.kpolicy.domain.engine;

import java.util.Map;

/**
 * Annotation-based opt-outs set by manifest authors.
 */
public class ExemptionFilter {

    public static final String EXEMPT_ALL_ANNOTATION = "polaris.fairwinds.com/exempt";
    public static final String EXEMPT_CHECK_ANNOTATION_PATTERN = "polaris.fairwinds.com/%s-exempt";

    /**
     * Whether {@code checkId} must be skipped for an object carrying {@code annotations}.
     * Always false when the policy disallows exemptions.
     */
    public boolean isExempt(Map<String, String> annotations, String checkId, boolean exemptionsDisallowed) {
        if (exemptionsDisallowed || annotations == null || annotations.isEmpty()) {
            return false;
        }
        return isTrue(annotations.get(EXEMPT_ALL_ANNOTATION))
                || isTrue(annotations.get(annotationFor(checkId)));
    }

    public static String annotationFor(String checkId) {
        return String.format(EXEMPT_CHECK_ANNOTATION_PATTERN, checkId);
    }

    private static boolean isTrue(String value) {
        return "true".equalsIgnoreCase(value);
    }
}
