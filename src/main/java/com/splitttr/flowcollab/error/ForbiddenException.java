package com.splitttr.flowcollab.error;

public class ForbiddenException extends CollabException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
