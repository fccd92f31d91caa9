package com.dealtracker.poller.application.job;

public enum DriverState {
    IDLE,
    RUNNING,
    /** Could not be scheduled. Terminal. */
    FAILED,
    /** Shut down in an orderly way. Terminal. */
    STOPPED
}
