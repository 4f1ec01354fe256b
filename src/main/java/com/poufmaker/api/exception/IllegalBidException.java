package com.poufmaker.api.exception;

public class IllegalBidException extends RuntimeException {
    public IllegalBidException(String message) {
        super(message);
    }
}
