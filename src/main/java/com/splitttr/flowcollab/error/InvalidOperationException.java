package com.splitttr.flowcollab.error;

public class InvalidOperationException extends CollabException {

    public InvalidOperationException(String message) {
        super(ErrorCode.INVALID_OPERATION, message);
    }
}
