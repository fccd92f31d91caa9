package com.dealtracker.poller.domain.exceptions;

/**
 * Upstream failure that may succeed on retry: timeouts, connection errors, 429 and 5xx.
 */
public class TransientMarketplaceException extends MarketplaceException {

    private TransientMarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransientMarketplaceException of(String operation, Throwable cause) {
        return new TransientMarketplaceException(operation + " failed: " + cause.getMessage(), cause);
    }

    public static TransientMarketplaceException status(String operation, int status) {
        return new TransientMarketplaceException(operation + " returned HTTP " + status, null);
    }
}
