package com.splitttr.flowcollab.error;

public class NotParticipantException extends CollabException {

    public NotParticipantException(String sessionId, String userId) {
        super(ErrorCode.NOT_PARTICIPANT, "User " + userId + " has not joined session " + sessionId);
    }
}
