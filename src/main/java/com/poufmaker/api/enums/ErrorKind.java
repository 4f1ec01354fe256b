package com.poufmaker.api.enums;

public enum ErrorKind {
    UNAUTHORIZED,
    NOT_FOUND,
    INVALID_REQUEST,
    CONFLICT,
    INVALID_STATE,
    INTERNAL
}
