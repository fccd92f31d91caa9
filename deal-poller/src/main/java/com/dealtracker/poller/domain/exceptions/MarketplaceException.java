package com.dealtracker.poller.domain.exceptions;

public abstract class MarketplaceException extends RuntimeException {

    protected MarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
