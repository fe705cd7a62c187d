package com.venuearb.domain;

public class ArbitrageException extends RuntimeException {

    public ArbitrageException(String message) {
        super(message);
    }

    public ArbitrageException(String message, Throwable cause) {
        super(message, cause);
    }
}
