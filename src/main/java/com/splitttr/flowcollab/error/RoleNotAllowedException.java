package com.splitttr.flowcollab.error;

public class RoleNotAllowedException extends CollabException {

    public RoleNotAllowedException(String message) {
        super(ErrorCode.ROLE_NOT_ALLOWED, message);
    }
}
