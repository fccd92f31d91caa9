package com.dealtracker.poller.domain.exceptions;

/**
 * Upstream failure that retrying will not fix: rejected credentials, other 4xx, unreadable body.
 */
public class FatalMarketplaceException extends MarketplaceException {

    private FatalMarketplaceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static FatalMarketplaceException status(String operation, int status) {
        return new FatalMarketplaceException(operation + " returned HTTP " + status, null);
    }

    public static FatalMarketplaceException malformed(String operation, Throwable cause) {
        return new FatalMarketplaceException(
                operation + " returned a malformed response: " + cause.getMessage(), cause);
    }

    public static FatalMarketplaceException malformed(String operation, String detail) {
        return new FatalMarketplaceException(operation + " returned a malformed response: " + detail, null);
    }
}
