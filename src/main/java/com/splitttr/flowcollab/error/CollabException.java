package com.splitttr.flowcollab.error;

/**
 * Root of the failures surfaced to a participant as an {@code error} message.
 */
public class CollabException extends RuntimeException {

    private final ErrorCode code;

    public CollabException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
