package com.poufmaker.api.exception;

public class DuplicateBidException extends RuntimeException {
    public DuplicateBidException(String message) {
        super(message);
    }
}
