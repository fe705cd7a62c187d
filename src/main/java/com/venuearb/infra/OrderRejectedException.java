package com.venuearb.infra;

import com.venuearb.domain.ArbitrageException;

public class OrderRejectedException extends ArbitrageException {

    public OrderRejectedException(String message) {
        super(message);
    }

    public OrderRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
