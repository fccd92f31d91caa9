package com.dealtracker.poller.domain.exceptions;

public class InvalidPollerConfigurationException extends RuntimeException {

    private InvalidPollerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidPollerConfigurationException of(String reason) {
        return new InvalidPollerConfigurationException("Poller cannot be scheduled: " + reason, null);
    }

    public static InvalidPollerConfigurationException of(String reason, Throwable cause) {
        return new InvalidPollerConfigurationException("Poller cannot be scheduled: " + reason, cause);
    }
}
