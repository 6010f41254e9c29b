package com.vidnyan.kpolicy.domain.error;

/**
 * The configuration references a check that is neither custom nor built-in.
 */
public class CheckNotFoundException extends PolicyEngineException {

    private final String checkId;
    private final String objectIdentity;

    public CheckNotFoundException(String checkId, String objectIdentity) {
        super(String.format("Check %s not found (while validating %s)", checkId, objectIdentity));
        this.checkId = checkId;
        this.objectIdentity = objectIdentity;
    }

    public String getCheckId() {
        return checkId;
    }

    public String getObjectIdentity() {
        return objectIdentity;
    }
}
