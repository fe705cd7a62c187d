package com.venuearb.domain;

/**
 * A path broke the currency-chain rules. Only raised while the catalog is built, so it aborts startup.
 */
public class InvalidPathException extends ArbitrageException {

    public InvalidPathException(String message) {
        super(message);
    }
}
