package com.vidnyan.kpolicy.domain.error;

/**
 * A check's predicate could not be evaluated against the fragment it was given.
 */
public class MalformedCheckException extends PolicyEngineException {

    private final String checkId;
    private final String objectIdentity;
    private final String detail;

    public MalformedCheckException(String detail, Throwable cause) {
        this(null, null, detail, cause);
    }

    public MalformedCheckException(String checkId, String objectIdentity, String detail, Throwable cause) {
        super(format(checkId, objectIdentity, detail), cause);
        this.checkId = checkId;
        this.objectIdentity = objectIdentity;
        this.detail = detail;
    }

    /**
     * Copy tagged with the check and object being evaluated.
     */
    public MalformedCheckException tagged(String checkId, String objectIdentity) {
        MalformedCheckException tagged = new MalformedCheckException(checkId, objectIdentity, detail, getCause());
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }

    public String getCheckId() {
        return checkId;
    }

    public String getObjectIdentity() {
        return objectIdentity;
    }

    public String getDetail() {
        return detail;
    }

    private static String format(String checkId, String objectIdentity, String detail) {
        if (checkId == null) {
            return detail;
        }
        return String.format("Check %s is malformed for %s: %s",
                checkId, objectIdentity == null ? "fragment" : objectIdentity, detail);
    }
}
