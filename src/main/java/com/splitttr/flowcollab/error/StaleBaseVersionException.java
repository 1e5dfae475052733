package com.splitttr.flowcollab.error;

/**
 * The submission was computed against a version older than the retained concurrent window.
 * The client must refetch and resubmit.
 */
public class StaleBaseVersionException extends CollabException {

    private final long baseVersion;
    private final long headVersion;

    public StaleBaseVersionException(long baseVersion, long headVersion, long retainedWindow) {
        super(ErrorCode.STALE_BASE_VERSION, "Base version " + baseVersion + " is more than "
            + retainedWindow + " versions behind head " + headVersion);
        this.baseVersion = baseVersion;
        this.headVersion = headVersion;
    }

    public long baseVersion() {
        return baseVersion;
    }

    public long headVersion() {
        return headVersion;
    }
}
