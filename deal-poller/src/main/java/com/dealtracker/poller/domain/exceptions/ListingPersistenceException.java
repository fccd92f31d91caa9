package com.dealtracker.poller.domain.exceptions;

public class ListingPersistenceException extends RuntimeException {

    private ListingPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ListingPersistenceException of(String storeId, String listingId, Throwable cause) {
        return new ListingPersistenceException(
                "Failed to persist listing " + storeId + "/" + listingId + ": " + cause.getMessage(), cause);
    }
}
