package com.splitttr.flowcollab.error;

public class SessionClosedException extends CollabException {

    public SessionClosedException(String sessionId) {
        super(ErrorCode.SESSION_CLOSED, "Session " + sessionId + " has ended");
    }
}
