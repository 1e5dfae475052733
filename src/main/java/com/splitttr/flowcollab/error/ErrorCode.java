package com.splitttr.flowcollab.error;

public enum ErrorCode {
    SESSION_CLOSED,
    CAPACITY_EXCEEDED,
    ROLE_NOT_ALLOWED,
    STALE_BASE_VERSION,
    BUSY,
    NOT_PARTICIPANT,
    FORBIDDEN,
    SESSION_NOT_FOUND,
    INVALID_OPERATION,
    INTERNAL
}
