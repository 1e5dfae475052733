package com.splitttr.flowcollab.error;

public class CapacityExceededException extends CollabException {

    public CapacityExceededException(String sessionId, int maxParticipants) {
        super(ErrorCode.CAPACITY_EXCEEDED,
            "Session " + sessionId + " is full (" + maxParticipants + " participants)");
    }
}
