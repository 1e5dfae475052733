package com.splitttr.flowcollab.error;

public class BusyException extends CollabException {

    public BusyException(String sessionId) {
        super(ErrorCode.BUSY, "Session " + sessionId + " is busy, retry shortly");
    }
}
