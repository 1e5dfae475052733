package com.splitttr.flowcollab.error;

public class SessionNotFoundException extends CollabException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
    }
}
